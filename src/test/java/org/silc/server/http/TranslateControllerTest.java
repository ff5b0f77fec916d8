package org.silc.server.http;

import com.typesafe.config.ConfigFactory;
import io.javalin.Javalin;
import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.silc.junit.extensions.logging.ExpectLog;
import org.silc.junit.extensions.logging.LogLevel;
import org.silc.junit.extensions.logging.LogWatchExtension;
import org.silc.service.TranslationService;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
public class TranslateControllerTest {

    private Javalin app;

    @BeforeEach
    void setUp() {
        TranslationService service = TranslationService.fromConfig(ConfigFactory.load().getConfig("silc"));
        app = Javalin.create(config -> config.showJavalinBanner = false);
        new TranslateController(service, ConfigFactory.empty()).registerRoutes(app, "/");
        app.start(0);

        RestAssured.baseURI = "http://localhost";
        RestAssured.port = app.port();
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.stop();
        }
        RestAssured.reset();
    }

    @Test
    void translate_shouldReturnAllSections() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"code\": \"var a = 1; if (a) { a = 2; }\"}")
            .when()
            .post("/translate")
            .then()
            .statusCode(200)
            .contentType(ContentType.JSON)
            .body("sil", equalTo("decl a\nmov a, 1\ncmp a\njmp_if_false L0\nmov a, 2\nL0:"))
            .body("python", equalTo("a = None\na = 1\nif a:\n    a = 2\n# label L0"))
            .body("cpp", containsString("    if (a) {\n        a = 2;\n    }"));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*\\[UNSUPPORTED_CONSTRUCT\\].*")
    void translate_shouldRejectUnsupportedConstruct() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"code\": \"do { x = 1; } while (x);\"}")
            .when()
            .post("/translate")
            .then()
            .statusCode(400)
            .body("status", equalTo(400))
            .body("code", equalTo("UNSUPPORTED_CONSTRUCT"))
            .body("message", containsString("DoLoop"))
            .body("timestamp", notNullValue());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*\\[SYNTAX_ERROR\\].*")
    void translate_shouldRejectSyntaxError() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"code\": \"var = ;\"}")
            .when()
            .post("/translate")
            .then()
            .statusCode(400)
            .body("code", equalTo("SYNTAX_ERROR"))
            .body("message", containsString("line 1"));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Translation of editor failed \\[SYNTAX_ERROR\\].*")
    void translate_shouldNameSourceFromOptions() {
        app.stop();
        TranslationService service = TranslationService.fromConfig(ConfigFactory.load().getConfig("silc"));
        app = Javalin.create(config -> config.showJavalinBanner = false);
        new TranslateController(service, ConfigFactory.parseString("source-name = editor")).registerRoutes(app, "/");
        app.start(0);
        RestAssured.port = app.port();

        given()
            .contentType(ContentType.JSON)
            .body("{\"code\": \"if (\"}")
            .when()
            .post("/translate")
            .then()
            .statusCode(400)
            .body("code", equalTo("SYNTAX_ERROR"));
    }

    @Test
    void translate_shouldRejectBlankCode() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"code\": \"   \"}")
            .when()
            .post("/translate")
            .then()
            .statusCode(400)
            .body("code", equalTo(TranslateController.EMPTY_SOURCE))
            .body("message", equalTo("No code provided."));
    }

    @Test
    void translate_shouldRejectMissingCodeField() {
        given()
            .contentType(ContentType.JSON)
            .body("{}")
            .when()
            .post("/translate")
            .then()
            .statusCode(400)
            .body("code", equalTo(TranslateController.EMPTY_SOURCE));
    }

    @Test
    void translate_shouldRejectMalformedBody() {
        given()
            .contentType(ContentType.JSON)
            .body("this is not json")
            .when()
            .post("/translate")
            .then()
            .statusCode(400)
            .body("code", equalTo(TranslateController.INVALID_REQUEST));
    }

    @Test
    void backends_shouldListSectionsInOutputOrder() {
        given()
            .when()
            .get("/translate/backends")
            .then()
            .statusCode(200)
            .body("sections", contains("sil", "python", "cpp"))
            .body("backends", contains("python", "cpp"));
    }
}
