package space.ketterling.waterstress.pipeline;

import java.util.List;

import space.ketterling.waterstress.features.FeatureRecord;
import space.ketterling.waterstress.output.RunSummary;
import space.ketterling.waterstress.quality.DataQualityLog;

/**
 * Everything a run produced: the feature table with its auxiliary column
 * layout, the summary and the data-quality log.
 */
public record PipelineResult(
        List<FeatureRecord> features,
        List<String> numericColumns,
        List<String> textColumns,
        RunSummary summary,
        DataQualityLog quality) {
}
