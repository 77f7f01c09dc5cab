package com.ormcost.origin;

import com.example.shop.ShopService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * TDD Unit Tests for OriginResolver.
 * Application frames are simulated by {@link ShopService}, which sits outside the internal packages.
 */
@DisplayName("OriginResolver")
class OriginResolverTest {

    private static final List<String> INTERNAL = List.of(
            "com.ormcost.", "java.", "javax.", "jdk.", "sun.", "org.junit.", "org.apache.maven.surefire."
    );

    private OriginResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new OriginResolver(new InternalFrameFilter(INTERNAL));
    }

    @Nested
    @DisplayName("Live Stack")
    class LiveStackTests {

        @Test
        @DisplayName("should skip internal frames and return the nearest application frame")
        void resolve_shouldReturnApplicationFrame() {
            ShopService shop = new ShopService(null, "ctx");

            Origin origin = shop.call(resolver::resolve);

            assertThat(origin.isAttributed()).isTrue();
            assertThat(origin.className()).isEqualTo(ShopService.class.getName());
            assertThat(origin.methodName()).isEqualTo("call");
            assertThat(origin.file()).isEqualTo("ShopService.java");
            assertThat(origin.line()).isPositive();
            assertThat(origin.location()).startsWith("ShopService.java:");
        }

        @Test
        @DisplayName("should return the same origin for the same call site")
        void resolve_sameCallSite_shouldBeEqual() {
            ShopService shop = new ShopService(null, "ctx");

            Origin first = shop.call(resolver::resolve);
            Origin second = shop.call(resolver::resolve);

            assertThat(first).isEqualTo(second);
        }

        @Test
        @DisplayName("should be unattributed when every frame is internal")
        void resolve_allInternal_shouldBeUnattributed() {
            OriginResolver everythingInternal = new OriginResolver(new InternalFrameFilter(
                    List.of("com.", "java.", "javax.", "jdk.", "sun.", "org.")));

            Origin origin = everythingInternal.resolve();

            assertThat(origin).isEqualTo(Origin.UNATTRIBUTED);
            assertThat(origin.isAttributed()).isFalse();
            assertThat(origin.location()).isEqualTo("unattributed");
        }
    }

    @Nested
    @DisplayName("Captured Stack")
    class CapturedStackTests {

        @Test
        @DisplayName("should pick the innermost non-internal element")
        void resolve_shouldPickInnermostApplicationElement() {
            List<StackTraceElement> stack = List.of(
                    new StackTraceElement("com.ormcost.engine.QueryCostEngine", "onQueryStart", "QueryCostEngine.java", 170),
                    new StackTraceElement("com.example.shop.OrderController", "show", "OrderController.java", 42),
                    new StackTraceElement("com.example.shop.Router", "dispatch", "Router.java", 10)
            );

            Origin origin = resolver.resolve(stack);

            assertThat(origin).isEqualTo(new Origin("OrderController.java", 42, "com.example.shop.OrderController", "show"));
            assertThat(origin.toString()).isEqualTo("OrderController.java:42");
        }

        @Test
        @DisplayName("should degrade missing file and line information")
        void resolve_missingDebugInfo_shouldUseUnknownMarkers() {
            List<StackTraceElement> stack = List.of(
                    new StackTraceElement("com.example.shop.Generated", "run", null, -1)
            );

            Origin origin = resolver.resolve(stack);

            assertThat(origin.file()).isEqualTo(Origin.UNKNOWN_FILE);
            assertThat(origin.line()).isZero();
            assertThat(origin.isAttributed()).isTrue();
            assertThat(origin.location()).isEqualTo("unknown");
        }

        @Test
        @DisplayName("should be unattributed for an empty or fully internal stack")
        void resolve_noApplicationElement_shouldBeUnattributed() {
            assertThat(resolver.resolve(List.of())).isEqualTo(Origin.UNATTRIBUTED);
            assertThat(resolver.resolve(List.of(
                    new StackTraceElement("java.lang.Thread", "run", "Thread.java", 833)
            ))).isEqualTo(Origin.UNATTRIBUTED);
        }
    }
}
