package app.corvana.importer.service.session;

import app.corvana.importer.config.ImportProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class ImportSessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(ImportSessionSweeper.class);

    private final ImportSessionRegistry registry;
    private final Duration ttl;

    public ImportSessionSweeper(ImportSessionRegistry registry, ImportProps props) {
        this.registry = registry;
        this.ttl = Duration.ofMinutes(props.sessionTtlMinutes());
    }

    @Scheduled(fixedDelayString = "${app.import.sweep-interval-ms:60000}")
    public void sweep() {
        sweep(Instant.now());
    }

    int sweep(Instant now) {
        List<UUID> expired = registry.expireIdleBefore(now.minus(ttl));
        if (!expired.isEmpty()) {
            log.info("Expired idle import sessions: count={}, remaining={}", expired.size(), registry.size());
        }
        return expired.size();
    }
}
