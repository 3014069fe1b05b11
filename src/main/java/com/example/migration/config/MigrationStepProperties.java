package com.example.migration.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Step definitions bound from {@code app.migration.steps}, run in declaration order.
 *
 * <pre>{@code
 * app:
 *   migration:
 *     steps:
 *       - name: usersStep
 *         target: users_v2
 *         sources: [communityusers, users]
 *       - name: blogsStep
 *         target: blogs
 *         sources: [blogposts]
 *         lookups: [blogtags, blogcategories]
 * }</pre>
 */
@ConfigurationProperties(prefix = "app.migration")
public record MigrationStepProperties(List<StepDefinition> steps) {

    public MigrationStepProperties {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * @param sourceTag tag written to the {@code source} field; only honoured for single-source
     *     steps, composite parts are tagged with their collection name
     * @param mapper name of the {@link com.example.migration.step.DocumentMapper} bean, {@code copy}
     *     when absent
     * @param lookups collections the mapper reads alongside the sources; never migrated themselves,
     *     but dropped with the sources
     */
    public record StepDefinition(String name, String target, List<String> sources, String sourceTag, String mapper,
            List<String> lookups) {
    }
}
