package com.blogicum.infrastructure.metrics;

import com.blogicum.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class AppMetrics implements MetricsPort {

    private final MeterRegistry registry;
    private final Counter registrations;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.registrations = Counter.builder("blog_registrations_total")
            .description("Total number of registered users")
            .register(registry);
    }

    @Override
    public void incrementFeedRequests(Feed feed) {
        Counter.builder("blog_feed_requests_total")
            .description("Total number of feed requests")
            .tag("feed", tagValue(feed))
            .register(registry)
            .increment();
    }

    @Override
    public void incrementMutations(Resource resource, Action action) {
        Counter.builder("blog_mutations_total")
            .description("Total number of applied writes")
            .tag("resource", tagValue(resource))
            .tag("action", tagValue(action))
            .register(registry)
            .increment();
    }

    @Override
    public void incrementOwnershipRedirects(Resource resource) {
        Counter.builder("blog_ownership_redirects_total")
            .description("Writes on someone else's resource answered with a redirect")
            .tag("resource", tagValue(resource))
            .register(registry)
            .increment();
    }

    @Override
    public void incrementRegistrations() {
        registrations.increment();
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
