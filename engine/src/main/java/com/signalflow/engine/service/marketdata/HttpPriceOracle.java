package com.signalflow.engine.service.marketdata;

import com.signalflow.engine.exception.PriceUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.function.Supplier;

/**
 * Reads last prices from a quote service exposing {@code GET /quotes/{symbol}}.
 * Calls are bounded by the RestTemplate timeouts, retried with exponential backoff
 * and guarded by a circuit breaker.
 */
@Slf4j
@Service
public class HttpPriceOracle implements PriceOracle {

    private final RestTemplate priceOracleRestTemplate;
    private final Retry priceOracleRetry;
    private final CircuitBreaker priceOracleCircuitBreaker;
    private final String baseUrl;

    public HttpPriceOracle(RestTemplate priceOracleRestTemplate,
                           @Qualifier("priceOracleRetry") Retry priceOracleRetry,
                           CircuitBreaker priceOracleCircuitBreaker,
                           @Value("${engine.price-oracle.base-url:http://localhost:8090}") String baseUrl) {
        this.priceOracleRestTemplate = priceOracleRestTemplate;
        this.priceOracleRetry = priceOracleRetry;
        this.priceOracleCircuitBreaker = priceOracleCircuitBreaker;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public double latestPrice(String symbol) {
        Supplier<Double> supplier = () -> fetch(symbol);
        Supplier<Double> decorated = Retry.decorateSupplier(priceOracleRetry, supplier);
        decorated = CircuitBreaker.decorateSupplier(priceOracleCircuitBreaker, decorated);
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            throw new PriceUnavailableException(symbol, "Price oracle circuit open", e);
        } catch (ResourceAccessException | HttpServerErrorException e) {
            log.warn("Price oracle unreachable for {} after {} attempts: {}",
                    symbol, priceOracleRetry.getRetryConfig().getMaxAttempts(), e.getMessage());
            throw new PriceUnavailableException(symbol, "Price oracle unavailable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.warn("Unusable quote response for {}: {}", symbol, e.getMessage());
            throw new PriceUnavailableException(symbol, "Unusable quote for " + symbol + ": " + e.getMessage(), e);
        }
    }

    private Double fetch(String symbol) {
        QuoteResponse quote;
        try {
            quote = priceOracleRestTemplate.getForObject(baseUrl + "/quotes/{symbol}", QuoteResponse.class, symbol);
        } catch (HttpClientErrorException e) {
            throw new PriceUnavailableException(symbol,
                    "No quote for " + symbol + " (" + e.getStatusCode().value() + ")", e);
        }
        if (quote == null || quote.price() == null) {
            throw new PriceUnavailableException(symbol, "Empty quote for " + symbol);
        }
        double price = quote.price();
        if (!Double.isFinite(price) || price <= 0) {
            throw new PriceUnavailableException(symbol, "Invalid price " + price + " for " + symbol);
        }
        return price;
    }
}
