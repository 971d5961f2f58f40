package com.example.symbolicengine.api.v1;

import com.example.symbolicengine.service.FormulaDefinitionService;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(FormulaControllerIntegrationTest.RestTestConfig.class)
@DisplayName("Formula CRUD API")
class FormulaControllerIntegrationTest {

    @TestConfiguration
    static class RestTestConfig {
        @Bean
        RestTemplate restTemplate() {
            RestTemplate rest = new RestTemplate();
            rest.setErrorHandler(new org.springframework.web.client.ResponseErrorHandler() {
                @Override
                public boolean hasError(ClientHttpResponse response) {
                    return false;
                }

                @Override
                public void handleError(java.net.URI url, HttpMethod method, ClientHttpResponse response) {
                }
            });
            return rest;
        }
    }

    @Value("${local.server.port}")
    private int port;

    @Autowired
    private RestTemplate restTemplate;

    private String baseUrl() {
        return "http://localhost:" + port + "/api/v1/formulas";
    }

    private HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private String create(String json) {
        ResponseEntity<Map<String, Object>> createResp = restTemplate.exchange(
                baseUrl(),
                HttpMethod.POST,
                new HttpEntity<>(json, jsonHeaders()),
                new ParameterizedTypeReference<>() {}
        );
        assertThat(createResp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(createResp.getBody()).isNotNull();
        return (String) createResp.getBody().get("id");
    }

    @SuppressWarnings("unchecked")
    private String sampleId(String name) {
        ResponseEntity<Map<String, Object>> samples = restTemplate.exchange(baseUrl() + "/samples", HttpMethod.GET, null,
                new ParameterizedTypeReference<Map<String, Object>>() {});
        List<Map<String, Object>> formulas = (List<Map<String, Object>>) samples.getBody().get("formulas");
        return formulas.stream()
                .filter(f -> name.equals(f.get("name")))
                .map(f -> (String) f.get("id"))
                .findFirst()
                .orElseThrow();
    }

    @SuppressWarnings("unchecked")
    private List<String> listedIds(String query) {
        ResponseEntity<Map<String, Object>> listResp = restTemplate.exchange(baseUrl() + query, HttpMethod.GET, null,
                new ParameterizedTypeReference<Map<String, Object>>() {});
        assertThat(listResp.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map<String, Object>> formulas = (List<Map<String, Object>>) listResp.getBody().get("formulas");
        return formulas.stream().map(f -> String.valueOf(f.get("id"))).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("full CRUD")
    class FullCrud {

        @Test
        @DisplayName("POST create returns 201; GET returns canonical form and symbols; PUT updates; DELETE returns 204; GET after delete returns 404")
        void createGetUpdateDelete() {
            String id = create("""
                    { "name": "Sphere volume", "description": "r is the radius", "expression": "4 / 3 * pi * r^3" }
                    """);

            ResponseEntity<Map> getResp = restTemplate.getForEntity(baseUrl() + "/" + id, Map.class);
            assertThat(getResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            Map<String, Object> body = getResp.getBody();
            assertThat(body).isNotNull();
            assertThat(body.get("name")).isEqualTo("Sphere volume");
            assertThat(body.get("expression")).isEqualTo("4 / 3 * pi * r^3");
            assertThat(body.get("canonicalForm")).isEqualTo("(((4) / (3)) * pi) * ((r)^(3))");
            assertThat(body.get("symbols")).isEqualTo(List.of("pi", "r"));
            assertThat(body.get("createdAt")).isNotNull();

            ResponseEntity<Map<String, Object>> listResp = restTemplate.exchange(baseUrl(), HttpMethod.GET, null,
                    new ParameterizedTypeReference<Map<String, Object>>() {});
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> formulas = (List<Map<String, Object>>) listResp.getBody().get("formulas");
            assertThat(formulas).anyMatch(f -> id.equals(String.valueOf(f.get("id"))));

            ResponseEntity<Map> updateResp = restTemplate.exchange(
                    baseUrl() + "/" + id,
                    HttpMethod.PUT,
                    new HttpEntity<>("{ \"name\": \"Sphere volume\", \"expression\": \"4 * pi * r^3 / 3\" }", jsonHeaders()),
                    Map.class
            );
            assertThat(updateResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(updateResp.getBody().get("canonicalForm")).isEqualTo("((4 * pi) * ((r)^(3))) / (3)");
            assertThat(updateResp.getBody().get("description")).isNull();

            ResponseEntity<Map> locationResp = restTemplate.exchange(
                    baseUrl(),
                    HttpMethod.POST,
                    new HttpEntity<>("{ \"name\": \"Located " + UUID.randomUUID() + "\", \"expression\": \"r^2\" }", jsonHeaders()),
                    Map.class
            );
            assertThat(locationResp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
            assertThat(locationResp.getHeaders().getLocation()).isNotNull();
            assertThat(locationResp.getHeaders().getLocation().getPath())
                    .isEqualTo("/api/v1/formulas/" + locationResp.getBody().get("id"));

            ResponseEntity<Void> deleteResp = restTemplate.exchange(baseUrl() + "/" + id, HttpMethod.DELETE, null, Void.class);
            assertThat(deleteResp.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);

            ResponseEntity<Map> getAfterDelete = restTemplate.getForEntity(baseUrl() + "/" + id, Map.class);
            assertThat(getAfterDelete.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("evaluate API")
    class EvaluateApi {

        @Test
        @DisplayName("seeded Cube volume evaluates to 8 for a = 2")
        @SuppressWarnings("unchecked")
        void seededCubeVolume() {
            ResponseEntity<Map<String, Object>> samples = restTemplate.exchange(baseUrl() + "/samples", HttpMethod.GET, null,
                    new ParameterizedTypeReference<Map<String, Object>>() {});
            List<Map<String, Object>> formulas = (List<Map<String, Object>>) samples.getBody().get("formulas");
            List<Object> names = formulas.stream().map(f -> f.get("name")).collect(Collectors.toList());
            assertThat(names).containsExactlyInAnyOrderElementsOf(FormulaDefinitionService.EXAMPLE_FORMULA_NAMES);
            String cubeId = formulas.stream()
                    .filter(f -> "Cube volume".equals(f.get("name")))
                    .map(f -> (String) f.get("id"))
                    .findFirst()
                    .orElseThrow();

            ResponseEntity<Map> evalResp = restTemplate.exchange(
                    baseUrl() + "/" + cubeId + "/evaluate",
                    HttpMethod.POST,
                    new HttpEntity<>(Map.of("a", 2), jsonHeaders()),
                    Map.class
            );
            assertThat(evalResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(evalResp.getBody().get("numeric")).isEqualTo(true);
            assertThat(((Number) evalResp.getBody().get("value")).longValue()).isEqualTo(8L);
        }

        @Test
        @DisplayName("evaluate without bindings returns the residual with unbound symbols")
        void evaluateResidual() {
            String id = create("{ \"name\": \"Residual " + UUID.randomUUID() + "\", \"expression\": \"x * (1 + 1)\" }");

            ResponseEntity<Map> evalResp = restTemplate.exchange(baseUrl() + "/" + id + "/evaluate", HttpMethod.POST, null, Map.class);
            assertThat(evalResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(evalResp.getBody().get("numeric")).isEqualTo(false);
            assertThat(evalResp.getBody().get("expression")).isEqualTo("x * 2");
            assertThat(evalResp.getBody().get("unboundSymbols")).isEqualTo(List.of("x"));
        }

        @Test
        @DisplayName("GET evaluate takes bindings from query parameters")
        void evaluateWithQueryParameters() {
            String cubeId = sampleId("Cube volume");

            ResponseEntity<Map> evalResp = restTemplate.getForEntity(baseUrl() + "/" + cubeId + "/evaluate?a=3", Map.class);
            assertThat(evalResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(((Number) evalResp.getBody().get("value")).longValue()).isEqualTo(27L);

            ResponseEntity<Map> halfResp = restTemplate.getForEntity(baseUrl() + "/" + cubeId + "/evaluate?a=0.5", Map.class);
            assertThat(((Number) halfResp.getBody().get("value")).doubleValue()).isEqualTo(0.125);

            ResponseEntity<Map> residualResp = restTemplate.getForEntity(baseUrl() + "/" + cubeId + "/evaluate", Map.class);
            assertThat(residualResp.getBody().get("numeric")).isEqualTo(false);
            assertThat(residualResp.getBody().get("unboundSymbols")).isEqualTo(List.of("a"));

            ResponseEntity<Map> badResp = restTemplate.getForEntity(baseUrl() + "/" + cubeId + "/evaluate?a=two", Map.class);
            assertThat(badResp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        }

        @Test
        @DisplayName("substitute rewrites the stored formula without changing it")
        void substitute() {
            String cubeId = sampleId("Cube volume");

            ResponseEntity<Map> subResp = restTemplate.exchange(
                    baseUrl() + "/" + cubeId + "/substitute",
                    HttpMethod.POST,
                    new HttpEntity<>(Map.of("a", "2 * s"), jsonHeaders()),
                    Map.class
            );
            assertThat(subResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(subResp.getBody().get("expression")).isEqualTo("(2 * s)^(3)");
            assertThat(subResp.getBody().get("symbols")).isEqualTo(List.of("s"));

            ResponseEntity<Map> stored = restTemplate.getForEntity(baseUrl() + "/" + cubeId, Map.class);
            assertThat(stored.getBody().get("canonicalForm")).isEqualTo("(a)^(3)");
        }

        @Test
        @DisplayName("list filtered by symbol returns only formulas that use it")
        void listBySymbol() {
            String radiusId = create("{ \"name\": \"Circle area " + UUID.randomUUID() + "\", \"expression\": \"pi * radius^2\" }");
            String cubeId = sampleId("Cube volume");

            List<String> withRadius = listedIds("?symbol=radius");
            assertThat(withRadius).contains(radiusId).doesNotContain(cubeId);
            assertThat(listedIds("")).contains(radiusId, cubeId);
        }

        @Test
        @DisplayName("evaluate of a non-existent formula returns 404")
        void evaluateNotFound() {
            ResponseEntity<Map> evalResp = restTemplate.exchange(
                    baseUrl() + "/" + UUID.randomUUID() + "/evaluate",
                    HttpMethod.POST,
                    new HttpEntity<>(Map.of("a", 1), jsonHeaders()),
                    Map.class
            );
            assertThat(evalResp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("error handling")
    class ErrorHandling {

        @Test
        @DisplayName("GET non-existent id returns 404")
        void getNotFoundReturns404() {
            ResponseEntity<Map> resp = restTemplate.getForEntity(baseUrl() + "/" + UUID.randomUUID(), Map.class);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(resp.getBody().get("message")).isNotNull();
        }

        @Test
        @DisplayName("DELETE non-existent id returns 404")
        void deleteNotFoundReturns404() {
            ResponseEntity<Void> resp = restTemplate.exchange(baseUrl() + "/" + UUID.randomUUID(), HttpMethod.DELETE, null, Void.class);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        }

        @Test
        @DisplayName("malformed path id returns 400")
        void malformedIdReturns400() {
            ResponseEntity<Map> resp = restTemplate.getForEntity(baseUrl() + "/not-a-uuid", Map.class);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        }

        @Test
        @DisplayName("POST with unparsable expression returns 400 with an expression error")
        void createInvalidExpressionReturns400() {
            ResponseEntity<Map<String, Object>> resp = restTemplate.exchange(
                    baseUrl(),
                    HttpMethod.POST,
                    new HttpEntity<>("{ \"name\": \"Bad\", \"expression\": \"(a + \" }", jsonHeaders()),
                    new ParameterizedTypeReference<>() {}
            );
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody().get("errors")).asList().isNotEmpty();
        }

        @Test
        @DisplayName("POST with a duplicate name returns 400")
        void duplicateNameReturns400() {
            String json = "{ \"name\": \"Duplicate " + UUID.randomUUID() + "\", \"expression\": \"a + 1\" }";
            create(json);

            ResponseEntity<Map<String, Object>> resp = restTemplate.exchange(
                    baseUrl(),
                    HttpMethod.POST,
                    new HttpEntity<>(json, jsonHeaders()),
                    new ParameterizedTypeReference<>() {}
            );
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(errorFields(resp.getBody())).containsExactly("name");
        }

        @Test
        @DisplayName("PUT renaming onto another formula's name returns 400 on the name field")
        void duplicateNameOnUpdateReturns400() {
            String takenName = "Taken " + UUID.randomUUID();
            create("{ \"name\": \"" + takenName + "\", \"expression\": \"a + 1\" }");
            String id = create("{ \"name\": \"Free " + UUID.randomUUID() + "\", \"expression\": \"a + 2\" }");

            ResponseEntity<Map<String, Object>> resp = restTemplate.exchange(
                    baseUrl() + "/" + id,
                    HttpMethod.PUT,
                    new HttpEntity<>("{ \"name\": \"" + takenName + "\", \"expression\": \"a + 2\" }", jsonHeaders()),
                    new ParameterizedTypeReference<>() {}
            );
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(errorFields(resp.getBody())).containsExactly("name");
        }

        @Test
        @DisplayName("POST with an expression over the configured length returns 400 and stores nothing")
        void overLongExpressionReturns400() {
            String name = "Long " + UUID.randomUUID();
            String expression = "1" + " + 1".repeat(60);
            assertThat(expression.length()).isGreaterThan(200);

            ResponseEntity<Map<String, Object>> resp = restTemplate.exchange(
                    baseUrl(),
                    HttpMethod.POST,
                    new HttpEntity<>(Map.of("name", name, "expression", expression), jsonHeaders()),
                    new ParameterizedTypeReference<>() {}
            );
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(errorFields(resp.getBody())).containsExactly("expression");

            ResponseEntity<Map<String, Object>> all = restTemplate.exchange(baseUrl(), HttpMethod.GET, null,
                    new ParameterizedTypeReference<Map<String, Object>>() {});
            assertThat(String.valueOf(all.getBody().get("formulas"))).doesNotContain(name);
        }

        @Test
        @DisplayName("PUT with an expression over the configured length returns 400 and keeps the formula evaluable")
        void overLongUpdateReturns400() {
            String id = create("{ \"name\": \"Short " + UUID.randomUUID() + "\", \"expression\": \"x + 1\" }");

            ResponseEntity<Map<String, Object>> resp = restTemplate.exchange(
                    baseUrl() + "/" + id,
                    HttpMethod.PUT,
                    new HttpEntity<>(Map.of("name", "Short", "expression", "x" + " + 1".repeat(60)), jsonHeaders()),
                    new ParameterizedTypeReference<>() {}
            );
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);

            ResponseEntity<Map> evalResp = restTemplate.getForEntity(baseUrl() + "/" + id + "/evaluate?x=1", Map.class);
            assertThat(evalResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(((Number) evalResp.getBody().get("value")).longValue()).isEqualTo(2L);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Object> errorFields(Map<String, Object> body) {
        List<Map<String, Object>> errors = (List<Map<String, Object>>) body.get("errors");
        return errors.stream().map(e -> e.get("field")).collect(Collectors.toList());
    }
}
