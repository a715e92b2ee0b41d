package it.aw.textoverlap.config;

import it.aw.textoverlap.model.MatchThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Bean del motore di confronto.
 *
 * MatchThresholds: soglie minime (lettere / parole) sotto cui una coppia è scartata.
 *                  Determinano anche gli shingle del pre-filtro.
 * overlapExecutor: pool dei worker, un passo per task. 0 = un thread per core.
 * Clock:           UTC, per i timestamp delle run.
 */
@Configuration
public class OverlapConfig {

    private static final Logger log = LoggerFactory.getLogger(OverlapConfig.class);

    @Value("${overlap.min-char-length:" + MatchThresholds.DEFAULT_MIN_CHAR_LENGTH + "}")
    private int minCharLength;

    @Value("${overlap.min-word-length:" + MatchThresholds.DEFAULT_MIN_WORD_LENGTH + "}")
    private int minWordLength;

    @Value("${overlap.workers:0}")
    private int workers;

    @Bean
    public MatchThresholds matchThresholds() {
        MatchThresholds thresholds = new MatchThresholds(minCharLength, minWordLength);
        log.info("Soglie di conservazione: {} lettere oppure {} parole", minCharLength, minWordLength);
        return thresholds;
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor overlapExecutor() {
        int threads = workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
        log.info("Pool di confronto: {} worker", threads);
        return new MdcAwareExecutor(threads, "overlap-worker");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
