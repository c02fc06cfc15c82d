package com.example.workflowhub.webhook;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WebhookHandlerRegistry")
class WebhookHandlerRegistryTest {

    @Test
    @DisplayName("routes by source and event type")
    void routes() {
        StubHandler created = new StubHandler("notion", Set.of("page.created"));
        StubHandler updated = new StubHandler("notion", Set.of("page.updated"));
        WebhookHandlerRegistry registry = registryOf(Map.of("created", created, "updated", updated));

        assertThat(registry.find("notion", "page.created")).containsSame(created);
        assertThat(registry.find("notion", "page.updated")).containsSame(updated);
        assertThat(registry.find("notion", "page.deleted")).isEmpty();
        assertThat(registry.find("amelia", "page.created")).isEmpty();
        assertThat(registry.find("notion", null)).isEmpty();
    }

    @Test
    @DisplayName("fails when two handlers claim the same source and event type")
    void duplicateFails() {
        Map<String, Object> beans = Map.of(
                "first", new StubHandler("amelia", Set.of("booking.created")),
                "second", new StubHandler("amelia", Set.of("booking.created", "booking.status_changed")));

        assertThatThrownBy(() -> registryOf(beans))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("source=amelia")
                .hasMessageContaining("eventType=booking.created");
    }

    private static WebhookHandlerRegistry registryOf(Map<String, Object> beans) {
        return new WebhookHandlerRegistry(new StaticListableBeanFactory(beans).getBeanProvider(WebhookEventHandler.class));
    }

    private record StubHandler(String source, Set<String> eventTypes) implements WebhookEventHandler {

        @Override
        public Map<String, Object> handle(WebhookEvent event) {
            return Map.of("handled", true);
        }
    }
}
