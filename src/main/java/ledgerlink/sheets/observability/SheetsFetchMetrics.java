package ledgerlink.sheets.observability;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Counters for spreadsheet fetch outcomes.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code sheets_fetch_total{strategy,outcome}} - fetches by credential source ({@code unresolved} when credential
 * resolution itself failed) and result ({@code success} or the failing exception's simple name)</li>
 * <li>{@code sheets_token_exchanges_total{result}} - OAuth2 token exchanges ({@code success}, {@code failure})</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class SheetsFetchMetrics {

    private final MeterRegistry registry;

    private final Map<String, Counter> fetchCounters = new ConcurrentHashMap<>();

    @Inject
    public SheetsFetchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param strategy
     *            credential source tag
     * @param outcome
     *            "success" or a failure name
     */
    public void incrementFetch(String strategy, String outcome) {
        String key = strategy + ":" + outcome;

        Counter counter = fetchCounters.computeIfAbsent(key, k -> {
            return Counter.builder("sheets_fetch_total").description("Total spreadsheet fetches")
                    .tags(List.of(Tag.of("strategy", strategy), Tag.of("outcome", outcome))).register(registry);
        });

        counter.increment();
    }

    public void incrementTokenExchange(boolean success) {
        Counter.builder("sheets_token_exchanges_total").description("Total OAuth2 JWT-bearer token exchanges")
                .tag("result", success ? "success" : "failure").register(registry).increment();
    }
}
