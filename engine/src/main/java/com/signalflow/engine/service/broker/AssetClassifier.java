package com.signalflow.engine.service.broker;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.model.AssetClass;
import com.signalflow.engine.model.TradingSignal;
import com.signalflow.engine.model.Venue;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Single place that decides whether a symbol trades on the crypto or the equity venue.
 */
@Component
public class AssetClassifier {

    private final Set<String> cryptoPairs;
    private final Pattern cryptoSuffix;

    public AssetClassifier(EngineProperties properties) {
        EngineProperties.Classification config = properties.getClassification();
        this.cryptoPairs = config.getCryptoPairs().stream()
                .map(AssetClassifier::normalize)
                .collect(Collectors.toUnmodifiableSet());
        String suffixes = config.getCryptoQuoteSuffixes().stream()
                .map(s -> Pattern.quote(s.toUpperCase(Locale.ROOT)))
                .collect(Collectors.joining("|"));
        this.cryptoSuffix = suffixes.isEmpty()
                ? null
                : Pattern.compile("^[A-Z0-9]+[/\\-]?(" + suffixes + ")$");
    }

    /** A signal that already carries its asset class keeps it; otherwise the symbol decides. */
    public AssetClass classify(TradingSignal signal) {
        if (signal.getAssetClass() != null) {
            return signal.getAssetClass();
        }
        return classify(signal.getSymbol());
    }

    public AssetClass classify(String symbol) {
        String normalized = normalize(symbol);
        if (cryptoPairs.contains(normalized)) {
            return AssetClass.CRYPTO;
        }
        if (cryptoSuffix != null && cryptoSuffix.matcher(normalized).matches()) {
            return AssetClass.CRYPTO;
        }
        return AssetClass.EQUITY;
    }

    public Venue venueFor(String symbol) {
        return Venue.of(classify(symbol));
    }

    private static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }
}
