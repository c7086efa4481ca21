package org.apisrv.http.routing;

import org.apisrv.common.HttpMethod;
import org.apisrv.exception.PathTemplateException;
import org.apisrv.http.pipeline.RequestHandler;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class RouterTest {

    private final Router router = new Router();

    private static RequestHandler handler() {
        return mock(RequestHandler.class);
    }

    @Test
    void methodIsNormalizedCaseInsensitively() {
        RouteDefinition route = router.add("get", "/status", handler());

        assertThat(route.method()).isEqualTo(HttpMethod.GET);
        assertThat(router.findRoute(HttpMethod.GET, "/status")).isPresent();
    }

    @Test
    void unsupportedMethodIsRejected() {
        assertThatThrownBy(() -> router.add("PATCH", "/status", handler()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("PATCH");
    }

    @Test
    void missingHandlerIsRejected() {
        assertThatThrownBy(() -> router.add("GET", "/status", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void compileFailuresPropagate() {
        assertThatThrownBy(() -> router.add("GET", "status", handler()))
                .isInstanceOf(PathTemplateException.class);
        assertThatThrownBy(() -> router.add("GET", "/[x:0]", handler()))
                .isInstanceOf(PathTemplateException.class);
    }

    @Test
    void exactTemplateWinsOverEarlierDynamicTemplate() {
        RequestHandler dynamic = handler();
        RequestHandler exact = handler();
        router.add("GET", "/users/{id}", dynamic);
        router.add("GET", "/users/me", exact);

        RouteMatch match = router.findRoute(HttpMethod.GET, "/users/me").orElseThrow();
        assertThat(match.route().handler()).isSameAs(exact);
        assertThat(match.pathParams()).isEmpty();

        assertThat(router.findRoute(HttpMethod.GET, "/users/7").orElseThrow().pathParams())
                .isEqualTo(Map.of("id", "7"));
    }

    @Test
    void overlappingDynamicTemplatesResolveInRegistrationOrder() {
        RequestHandler first = handler();
        RequestHandler second = handler();
        router.add("GET", "/a/{x}", first);
        router.add("GET", "/{y}/b", second);

        assertThat(router.findRoute(HttpMethod.GET, "/a/b").orElseThrow().route().handler()).isSameAs(first);
        assertThat(router.findRoute(HttpMethod.GET, "/c/b").orElseThrow().route().handler()).isSameAs(second);
    }

    @Test
    void reRegisteringReplacesInPlace() {
        RequestHandler first = handler();
        RequestHandler second = handler();
        RequestHandler other = handler();
        router.add("GET", "/a/{x}", first);
        router.add("GET", "/{y}/b", other);
        router.add("GET", "/a/{x}", second);

        assertThat(router.getRoutes()).hasSize(2);
        assertThat(router.findRoute(HttpMethod.GET, "/a/b").orElseThrow().route().handler()).isSameAs(second);
    }

    @Test
    void exactTemplateMatchesWithExtraTrailingSlash() {
        router.add("GET", "/foo", handler());

        assertThat(router.findRoute(HttpMethod.GET, "/foo")).isPresent();
        assertThat(router.findRoute(HttpMethod.GET, "/foo/")).isPresent();
        assertThat(router.findRoute(HttpMethod.GET, "/foo//")).isEmpty();
    }

    @Test
    void templateTrailingSlashIsSignificant() {
        router.add("GET", "/needs-slash/", handler());

        assertThat(router.findRoute(HttpMethod.GET, "/needs-slash")).isEmpty();
        assertThat(router.findRoute(HttpMethod.GET, "/needs-slash/")).isPresent();
    }

    @Test
    void lookupOnlyConsultsTheRequestedMethod() {
        router.add("POST", "/items", handler());

        assertThat(router.findRoute(HttpMethod.GET, "/items")).isEmpty();
        assertThat(router.hasOtherMethodMatch(HttpMethod.GET, "/items")).isTrue();
        assertThat(router.hasOtherMethodMatch(HttpMethod.POST, "/items")).isFalse();
        assertThat(router.hasOtherMethodMatch(HttpMethod.GET, "/other")).isFalse();
    }

    @Test
    void hasOtherMethodMatchUsesTemplates() {
        router.add("DELETE", "/items/{id}", handler());

        assertThat(router.hasOtherMethodMatch(HttpMethod.GET, "/items/3")).isTrue();
        assertThat(router.hasOtherMethodMatch(HttpMethod.GET, "/items/3/x")).isFalse();
    }

    @Test
    void deleteRemovesOnlyTheGivenMethod() {
        router.add("GET", "/dynamic", handler());
        router.add("POST", "/dynamic", handler());

        assertThat(router.delete("GET", "/dynamic")).isTrue();

        assertThat(router.findRoute(HttpMethod.GET, "/dynamic")).isEmpty();
        assertThat(router.findRoute(HttpMethod.POST, "/dynamic")).isPresent();
        assertThat(router.hasOtherMethodMatch(HttpMethod.GET, "/dynamic")).isTrue();
    }

    @Test
    void wildcardDeleteRemovesAcrossMethods() {
        router.add("GET", "/dynamic/{id}", handler());
        router.add("PUT", "/dynamic/{id}", handler());
        router.add("PUT", "/keep", handler());

        assertThat(router.delete("*", "/dynamic/{id}")).isTrue();

        assertThat(router.findRoute(HttpMethod.GET, "/dynamic/1")).isEmpty();
        assertThat(router.findRoute(HttpMethod.PUT, "/dynamic/1")).isEmpty();
        assertThat(router.hasOtherMethodMatch(HttpMethod.POST, "/dynamic/1")).isFalse();
        assertThat(router.findRoute(HttpMethod.PUT, "/keep")).isPresent();
        assertThat(router.delete("*", "/dynamic/{id}")).isFalse();
    }

    @Test
    void deleteUsesTheLiteralTemplate() {
        router.add("GET", "/items/{id}", handler());

        assertThat(router.delete("GET", "/items/1")).isFalse();
        assertThat(router.delete("GET", "/items/{id}")).isTrue();
    }

    @Test
    void deletingUnknownRouteReturnsFalse() {
        assertThat(router.delete("GET", "/nothing")).isFalse();
        assertThat(router.delete("*", "/nothing")).isFalse();
    }

    @Test
    void deleteRejectsBadArguments() {
        assertThatThrownBy(() -> router.delete("GET", "nothing")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> router.delete("TRACE", "/nothing")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addThenDeleteBehavesAsNeverRegistered() {
        router.add("GET", "/tmp", handler());
        router.delete("GET", "/tmp");

        assertThat(router.findRoute(HttpMethod.GET, "/tmp")).isEmpty();
        assertThat(router.hasOtherMethodMatch(HttpMethod.GET, "/tmp")).isFalse();
        assertThat(router.getRoutes()).isEmpty();
    }

    @Test
    void lookupsStayConsistentDuringConcurrentMutation() throws Exception {
        RequestHandler stable = handler();
        router.add("GET", "/stable/{id}", stable);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch started = new CountDownLatch(1);
        try {
            Future<?> writer = pool.submit(() -> {
                started.countDown();
                for (int i = 0; running.get(); i++) {
                    router.add("GET", "/churn/" + (i % 16) + "/{x}", handler());
                    router.delete("*", "/churn/" + ((i + 8) % 16) + "/{x}");
                }
            });
            started.await();
            List<Future<Boolean>> readers = new ArrayList<>();
            for (int r = 0; r < 3; r++) {
                readers.add(pool.submit(() -> {
                    for (int i = 0; i < 20_000; i++) {
                        RouteMatch match = router.findRoute(HttpMethod.GET, "/stable/" + i).orElseThrow();
                        if (match.route().handler() != stable || !match.pathParams().get("id").equals(String.valueOf(i))) {
                            return false;
                        }
                    }
                    return true;
                }));
            }
            for (Future<Boolean> reader : readers) {
                assertThat(reader.get(30, TimeUnit.SECONDS)).isTrue();
            }
            running.set(false);
            writer.get(30, TimeUnit.SECONDS);
        } finally {
            running.set(false);
            pool.shutdownNow();
        }
    }

}
