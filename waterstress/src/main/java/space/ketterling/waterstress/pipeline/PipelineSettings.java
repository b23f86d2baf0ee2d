package space.ketterling.waterstress.pipeline;

import space.ketterling.waterstress.config.AppConfig;
import space.ketterling.waterstress.zonal.ContainmentRule;
import space.ketterling.waterstress.zonal.Statistic;

/**
 * The processing knobs of a run, separate from input and output locations.
 */
public record PipelineSettings(
        Statistic statistic,
        ContainmentRule containmentRule,
        double droughtThresholdCm,
        String stressScoreColumn,
        int workerThreads,
        boolean cacheAggregates) {

    public static PipelineSettings from(AppConfig cfg) {
        return new PipelineSettings(cfg.statistic(), cfg.containmentRule(), cfg.droughtThresholdCm(),
                cfg.stressLabelEnabled() ? cfg.stressScoreColumn() : null, cfg.workerThreads(),
                cfg.cacheAggregates());
    }

    /**
     * Mean over cell centres, -5 cm drought threshold, no stress label.
     */
    public static PipelineSettings defaults(int workers) {
        return new PipelineSettings(Statistic.MEAN, ContainmentRule.CENTER,
                AppConfig.DEFAULT_DROUGHT_THRESHOLD_CM, null, workers, true);
    }
}
