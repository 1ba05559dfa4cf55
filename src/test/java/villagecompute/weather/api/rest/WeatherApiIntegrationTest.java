/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.rest;

import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;

import org.junit.jupiter.api.Test;

import com.github.tomakehurst.wiremock.WireMockServer;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import villagecompute.weather.testing.InjectWireMock;
import villagecompute.weather.testing.WeatherUpstreamTestResource;

/**
 * Boots the application against a WireMock OpenWeatherMap and drives the REST endpoints end to end: configuration,
 * CDI wiring, the {@code @RateLimited} filter binding and JSON serialization.
 *
 * <p>
 * Each test uses its own X-Forwarded-For address so the per-client buckets do not interfere.
 */
@QuarkusTest
@QuarkusTestResource(
        value = WeatherUpstreamTestResource.class,
        restrictToAnnotatedClass = true)
class WeatherApiIntegrationTest {

    private static final String LONDON = "51.5074,-0.1278";

    @InjectWireMock
    WireMockServer wireMock;

    @Test
    void testSummary_includesLocationAboveThreshold() {
        given().header("X-Forwarded-For", "203.0.113.1").queryParam("locations", LONDON)
                .queryParam("temperature", "20").queryParam("unit", "celsius").when().get("/api/v1/weather/summary")
                .then().statusCode(200).header("X-RateLimit-Limit", notNullValue()).body("locations", hasSize(1))
                .body("locations[0].location_id", equalTo(LONDON))
                .body("locations[0].location_name", equalTo("London"))
                .body("locations[0].tomorrow_max_temperature", equalTo(25.0f))
                .body("locations[0].temperature_unit", equalTo("celsius"))
                .body("metadata.source", equalTo("weather-summary-api"))
                .body("metadata.rate_limit_remaining", greaterThan(0));
    }

    @Test
    void testSummary_excludesLocationAtOrBelowThreshold() {
        given().header("X-Forwarded-For", "203.0.113.2").queryParam("locations", LONDON)
                .queryParam("temperature", "30").when().get("/api/v1/weather/summary").then().statusCode(200)
                .body("locations", hasSize(0));
    }

    @Test
    void testSummary_malformedLocationsIsValidationError() {
        given().header("X-Forwarded-For", "203.0.113.3").queryParam("locations", "51.5074")
                .queryParam("temperature", "20").when().get("/api/v1/weather/summary").then().statusCode(400)
                .body("error.code", equalTo("VALIDATION_ERROR"))
                .body("error.details.reason_code", notNullValue());
    }

    @Test
    void testLocationDetails_returnsLocationAndForecast() {
        given().header("X-Forwarded-For", "203.0.113.4").when().get("/api/v1/weather/locations/" + LONDON).then()
                .statusCode(200).body("location.id", equalTo(LONDON)).body("location.name", equalTo("London"))
                .body("location.country", equalTo("GB")).body("forecast", hasSize(2))
                .body("forecast[1].temperature_max", equalTo(25.0f));
    }

    @Test
    void testLocationDetails_unresolvableLocationIsNotFound() {
        given().header("X-Forwarded-For", "203.0.113.5").when()
                .get("/api/v1/weather/locations/" + WeatherUpstreamTestResource.UNKNOWN_LATITUDE + ",20.0").then()
                .statusCode(404).body("error.code", equalTo("NOT_FOUND"));
    }

    @Test
    void testLocationDetails_burstLimitReturns429() {
        for (int i = 0; i < WeatherUpstreamTestResource.BURST_LIMIT; i++) {
            given().header("X-Forwarded-For", "203.0.113.6").when().get("/api/v1/weather/locations/" + LONDON).then()
                    .statusCode(200);
        }

        given().header("X-Forwarded-For", "203.0.113.6").when().get("/api/v1/weather/locations/" + LONDON).then()
                .statusCode(429).header("Retry-After", notNullValue())
                .body("error.code", equalTo("BURST_LIMIT_EXCEEDED")).body("error.details.layer", equalTo("burst"));
    }

    @Test
    void testHealth_repeatedChecksDoNotCallUpstream() {
        wireMock.resetRequests();

        for (int i = 0; i < 10; i++) {
            given().when().get("/api/health").then().statusCode(200).body("provider", equalTo("OpenWeatherMap"))
                    .body("caches", hasSize(3));
        }

        wireMock.verify(0, getRequestedFor(urlPathEqualTo("/data/2.5/weather")));
        wireMock.verify(0, getRequestedFor(urlPathEqualTo("/data/2.5/forecast")));
        wireMock.verify(0, getRequestedFor(urlPathEqualTo("/geo/1.0/reverse")));
    }

    @Test
    void testRateLimitStatus_reportsGlobalBucket() {
        given().when().get("/api/v1/weather/rate-limit").then().statusCode(200).body("max_requests", equalTo(1000))
                .body("algorithm", notNullValue());
    }
}
