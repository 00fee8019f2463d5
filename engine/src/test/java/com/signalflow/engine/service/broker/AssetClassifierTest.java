package com.signalflow.engine.service.broker;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.model.AssetClass;
import com.signalflow.engine.model.TradingSignal;
import com.signalflow.engine.model.Venue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AssetClassifierTest {

    private AssetClassifier classifier(List<String> pairs) {
        EngineProperties properties = new EngineProperties();
        properties.getClassification().setCryptoPairs(pairs);
        return new AssetClassifier(properties);
    }

    @Test
    void quoteSuffixMeansCrypto() {
        AssetClassifier classifier = classifier(List.of());

        assertThat(classifier.classify("BTCUSDT")).isEqualTo(AssetClass.CRYPTO);
        assertThat(classifier.classify("eth/usdc")).isEqualTo(AssetClass.CRYPTO);
        assertThat(classifier.classify("SOL-BUSD")).isEqualTo(AssetClass.CRYPTO);
        assertThat(classifier.venueFor("BTCUSDT")).isEqualTo(Venue.BINANCE);
    }

    @Test
    void plainTickersAreEquities() {
        AssetClassifier classifier = classifier(List.of());

        assertThat(classifier.classify("AAPL")).isEqualTo(AssetClass.EQUITY);
        assertThat(classifier.classify("BRK.B")).isEqualTo(AssetClass.EQUITY);
        assertThat(classifier.venueFor("MSFT")).isEqualTo(Venue.ALPACA);
    }

    @Test
    void configuredPairsWinOverSuffixRules() {
        AssetClassifier classifier = classifier(List.of("BTCEUR"));

        assertThat(classifier.classify("btceur")).isEqualTo(AssetClass.CRYPTO);
        assertThat(classifier.classify("USDT")).isEqualTo(AssetClass.EQUITY);
    }

    @Test
    void signalAssetClassTakesPrecedence() {
        AssetClassifier classifier = classifier(List.of());
        TradingSignal signal = TradingSignal.builder().symbol("COIN").assetClass(AssetClass.CRYPTO).build();

        assertThat(classifier.classify(signal)).isEqualTo(AssetClass.CRYPTO);
        signal.setAssetClass(null);
        assertThat(classifier.classify(signal)).isEqualTo(AssetClass.EQUITY);
    }
}
