package com.ttlcache.api;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;

@QuarkusTest
class CacheResourceTest {

    @Test
    void putThenGetEntry() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"value\":\"external\",\"ttlMillis\":60000}")
                .when()
                .put("/cache/sample-key")
                .then()
                .statusCode(204);

        given()
                .when()
                .get("/cache/sample-key")
                .then()
                .statusCode(200)
                .body("key", equalTo("sample-key"))
                .body("value", equalTo("external"));
    }

    @Test
    void ttlReportsRemainingMillis() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"value\":\"timed\",\"ttlMillis\":60000}")
                .when()
                .put("/cache/ttl-key")
                .then()
                .statusCode(204);

        given()
                .when()
                .get("/cache/ttl-key/ttl")
                .then()
                .statusCode(200)
                .body("key", equalTo("ttl-key"))
                .body("ttlMillis", allOf(greaterThan(0), lessThanOrEqualTo(60000)));
    }

    @Test
    void getMissingKeyReturns404() {
        given()
                .when()
                .get("/cache/missing-key")
                .then()
                .statusCode(404)
                .body("message", equalTo("Key not found"));

        given()
                .when()
                .get("/cache/missing-key/ttl")
                .then()
                .statusCode(404);
    }

    @Test
    void sizeCountsStoredEntries() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"value\":\"counted\",\"ttlMillis\":60000}")
                .when()
                .put("/cache/size-key")
                .then()
                .statusCode(204);

        given()
                .when()
                .get("/cache")
                .then()
                .statusCode(200)
                .body("size", greaterThanOrEqualTo(1));
    }

    @Test
    void putWithoutValueFails() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"ttlMillis\":1000}")
                .when()
                .put("/cache/no-value")
                .then()
                .statusCode(400)
                .body("message", equalTo("value must be provided"));
    }

    @Test
    void putWithoutPositiveTtlFails() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"value\":\"x\",\"ttlMillis\":0}")
                .when()
                .put("/cache/no-ttl")
                .then()
                .statusCode(400)
                .body("message", equalTo("ttlMillis must be positive"));

        given()
                .when()
                .get("/cache/no-ttl")
                .then()
                .statusCode(404);
    }
}
