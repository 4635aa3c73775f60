package dev.pekelund.docflow.processor;

import com.google.cloud.ServiceOptions;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.springframework.util.StringUtils;

/**
 * Firestore coordinates resolved from the process environment.
 */
public record DocumentProcessingSettings(
    String projectId,
    String tenantsCollection,
    String locksCollection
) {

    static final String DEFAULT_TENANTS_COLLECTION = "docflow-tenants";
    static final String DEFAULT_LOCKS_COLLECTION = "docflow-locks";
    private static final String DEFAULT_LOCAL_PROJECT_ID = "docflow-local";

    public static DocumentProcessingSettings fromEnvironment() {
        return fromEnvironment(System.getenv(), ServiceOptions::getDefaultProjectId);
    }

    static DocumentProcessingSettings fromEnvironment(Map<String, String> env,
        Supplier<String> defaultProjectSupplier) {

        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(defaultProjectSupplier, "defaultProjectSupplier");

        String tenantsCollection = env.getOrDefault("DOCFLOW_FIRESTORE_ROOT", DEFAULT_TENANTS_COLLECTION);
        String locksCollection = env.getOrDefault("DOCFLOW_FIRESTORE_LOCKS", DEFAULT_LOCKS_COLLECTION);
        String projectId = firstNonEmpty(
            env.get("PROJECT_ID"),
            env.get("FIRESTORE_PROJECT_ID"),
            env.get("GOOGLE_CLOUD_PROJECT"),
            env.get("GCLOUD_PROJECT"),
            env.get("GCP_PROJECT"),
            defaultProjectSupplier.get());

        String localProjectId = env.getOrDefault("LOCAL_PROJECT_ID", DEFAULT_LOCAL_PROJECT_ID);

        if (StringUtils.hasText(localProjectId) && localProjectId.equals(projectId) && isRunningOnCloudRun(env)) {
            throw new IllegalStateException(String.format("Firestore project id resolved to local project '%s' while"
                + " running on Cloud Run. Update the deployment environment to use the production project id.",
                projectId));
        }

        if (!StringUtils.hasText(projectId)) {
            throw new IllegalStateException("Firestore project id must be configured via PROJECT_ID "
                + "or available from the Cloud environment.");
        }

        return new DocumentProcessingSettings(projectId, tenantsCollection, locksCollection);
    }

    private static boolean isRunningOnCloudRun(Map<String, String> env) {
        return StringUtils.hasText(env.get("K_SERVICE"));
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
