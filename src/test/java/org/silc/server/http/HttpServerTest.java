package org.silc.server.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.silc.service.TranslationService;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.notNullValue;

@Tag("integration")
public class HttpServerTest {

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        Config silc = ConfigFactory.load().getConfig("silc");
        Config serverOptions = silc.getConfig("server")
                .withValue("host", ConfigValueFactory.fromAnyRef("127.0.0.1"))
                .withValue("port", ConfigValueFactory.fromAnyRef(0));
        server = new HttpServer(TranslationService.fromConfig(silc), serverOptions);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.port();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void servesBrowserClientFromClasspath() {
        given()
            .when()
            .get(baseUrl + "/")
            .then()
            .statusCode(200)
            .body(containsString("<textarea"));

        given()
            .when()
            .get(baseUrl + "/script.js")
            .then()
            .statusCode(200)
            .body(containsString("/translate"));
    }

    @Test
    void answersCrossOriginRequests() {
        given()
            .header("Origin", "http://example.org")
            .contentType("application/json")
            .body("{\"code\": \"var a;\"}")
            .when()
            .post(baseUrl + "/translate")
            .then()
            .statusCode(200)
            .header("Access-Control-Allow-Origin", notNullValue());
    }

    @Test
    void portIsUnavailableAfterStop() {
        assertThat(server.port()).isPositive();

        server.stop();

        assertThatThrownBy(() -> server.port()).isInstanceOf(IllegalStateException.class);
    }
}
