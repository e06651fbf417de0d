package com.hybridsignal.engine.threshold;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.hybridsignal.core.exception.ThresholdConfigurationException;
import com.hybridsignal.core.zone.ComparisonOperator;
import com.hybridsignal.core.zone.ThresholdBook;
import com.hybridsignal.core.zone.ZoneScale;
import com.hybridsignal.core.zone.ZoneThreshold;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reads a {@link ThresholdDocument} from YAML and turns it into a validated
 * {@link ThresholdBook}. Any malformed or ambiguous entry fails the load with
 * {@link ThresholdConfigurationException}.
 */
public class YamlThresholdLoader {

    private static final Logger log = LoggerFactory.getLogger(YamlThresholdLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper yamlMapper = new YAMLMapper();

    public YamlThresholdLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /** @param location Spring resource location, e.g. {@code classpath:thresholds.yml} */
    public ThresholdBook load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ThresholdConfigurationException("threshold resource not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            ThresholdBook book = parse(in, location);
            log.info("THRESHOLDS_SOURCE location={} instrumentKeys={} marketKeys={}",
                     location, book.instrumentKeyCount(), book.marketKeyCount());
            return book;
        } catch (IOException e) {
            throw new ThresholdConfigurationException("cannot read " + location + ": " + e.getMessage(), e);
        }
    }

    public ThresholdBook parse(InputStream in, String label) {
        ThresholdDocument doc;
        try {
            doc = yamlMapper.readValue(in, ThresholdDocument.class);
        } catch (IOException e) {
            throw new ThresholdConfigurationException("malformed threshold YAML in " + label + ": " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new ThresholdConfigurationException("threshold YAML in " + label + " is empty");
        }
        return toBook(doc);
    }

    ThresholdBook toBook(ThresholdDocument doc) {
        ZoneScale scale = doc.zoneOrder() == null || doc.zoneOrder().isEmpty()
            ? ZoneScale.DEFAULT
            : ZoneScale.of(doc.zoneOrder());

        ThresholdBook.Builder builder = ThresholdBook.builder(scale).defaultMarket(doc.defaultMarket());

        orEmpty(doc.instrumentMarkets()).forEach(builder::instrumentMarket);

        orEmpty(doc.markets()).forEach((market, sets) ->
            forEachRow(market, sets, row -> builder.marketThreshold(market, row)));

        orEmpty(doc.instruments()).forEach((instrumentId, sets) ->
            forEachRow(instrumentId, sets, builder::instrumentThreshold));

        return builder.build();
    }

    // ── row expansion ───────────────────────────────────────────────────────

    private static void forEachRow(String owner, List<ThresholdDocument.ZoneSet> sets,
                                   Consumer<ZoneThreshold> sink) {
        if (sets == null) return;
        for (ThresholdDocument.ZoneSet set : sets) {
            if (set.indicator() == null || set.indicator().isBlank()) {
                throw new ThresholdConfigurationException(owner + ": zone set without indicator");
            }
            if (set.timeframes() == null || set.timeframes().isEmpty()) {
                throw new ThresholdConfigurationException(
                    owner + " " + set.indicator() + ": zone set without timeframes");
            }
            List<ThresholdDocument.ZoneRow> rows = set.zones() == null ? List.of() : set.zones();
            for (String timeframe : set.timeframes()) {
                for (ThresholdDocument.ZoneRow row : rows) {
                    sink.accept(toThreshold(owner, timeframe, set.indicator(), row));
                }
            }
        }
    }

    private static ZoneThreshold toThreshold(String owner, String timeframe, String indicator,
                                             ThresholdDocument.ZoneRow row) {
        if (row.zone() == null || row.zone().isBlank()) {
            throw new ThresholdConfigurationException(
                owner + " " + indicator + "@" + timeframe + ": zone row without a zone name");
        }
        if (row.min() == null) {
            throw new ThresholdConfigurationException(
                owner + " " + indicator + "@" + timeframe + ": zone '" + row.zone() + "' has no min value");
        }
        return ZoneThreshold.of(owner, timeframe, indicator, row.zone(),
                                ComparisonOperator.fromSymbol(row.comparison()), row.min(), row.max());
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
        return map == null ? Map.of() : map;
    }
}
