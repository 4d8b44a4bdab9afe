package app.corvana.importer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.import")
public record ImportProps(
        Integer matchThreshold,
        Integer maxContactSlots,
        Integer sessionTtlMinutes,
        Long sweepIntervalMs,
        Integer maxExistingLeads,
        Integer leadPageSize,
        Integer commitThreads,
        Integer commitQueueCapacity
) {
    public ImportProps {
        if (matchThreshold == null) {
            matchThreshold = 85;
        }
        if (maxContactSlots == null) {
            maxContactSlots = 5;
        }
        if (sessionTtlMinutes == null) {
            sessionTtlMinutes = 60;
        }
        if (sweepIntervalMs == null) {
            sweepIntervalMs = 60_000L;
        }
        if (maxExistingLeads == null) {
            maxExistingLeads = 50_000;
        }
        if (leadPageSize == null) {
            leadPageSize = 500;
        }
        if (commitThreads == null) {
            commitThreads = 4;
        }
        if (commitQueueCapacity == null) {
            commitQueueCapacity = 100;
        }
    }

    public static ImportProps defaults() {
        return new ImportProps(null, null, null, null, null, null, null, null);
    }
}
