package ai.yarrow.analysis.runtime;

import ai.yarrow.v1.YA;
import ai.yarrow.v1.YR;
import ai.yarrow.v1.YV;

/**
 * Blocking calls into the runtime engine. Every call carries the whole analysis together with the values
 * released so far.
 */
public interface RuntimeClient {

    YR.ValidateAnalysisResponse validate(YA.Analysis analysis, YA.Release release);

    YV.PrivacyUsage computePrivacyUsage(YA.Analysis analysis, YA.Release release);

    YA.Release computeRelease(YA.Analysis analysis, YA.Release release);

    String generateReport(YA.Analysis analysis, YA.Release release);
}
