package ai.attackframework.tools.searchengine.utils;

/**
 * Centralized version accessor.
 * Production: reads Implementation-Version from the JAR manifest.
 * Tests: may set -Dsearchengine.version=<value> to run without a JAR.
 */
public final class Version {

    public static final String PROPERTY = "searchengine.version";

    private Version() {}

    public static String get() {
        String override = System.getProperty(PROPERTY);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        Package p = Version.class.getPackage();
        String mv = (p != null) ? p.getImplementationVersion() : null;
        if (mv == null || mv.isBlank()) {
            throw new IllegalStateException(
                    "Implementation-Version not found in manifest. " +
                            "Set -D" + PROPERTY + " for tests or run from the packaged JAR."
            );
        }
        return mv;
    }
}
