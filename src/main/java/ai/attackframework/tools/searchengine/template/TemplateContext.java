package ai.attackframework.tools.searchengine.template;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Environment values consumed by template expansion.
 *
 * <p>Both values are read through suppliers on every expansion so that a change of the
 * default locale is picked up without rebuilding engines.</p>
 */
public final class TemplateContext {

    /** System property naming the host application for the {@code {source}} token. */
    public static final String APPLICATION_NAME_PROPERTY = "searchengine.applicationName";

    static final String DEFAULT_APPLICATION_NAME = "searchengine";

    private final Supplier<Locale> locale;
    private final Supplier<String> applicationName;

    public TemplateContext(Supplier<Locale> locale, Supplier<String> applicationName) {
        this.locale = Objects.requireNonNull(locale, "locale");
        this.applicationName = Objects.requireNonNull(applicationName, "applicationName");
    }

    /** Fixed locale and application name; mostly useful in tests and tools. */
    public static TemplateContext of(Locale locale, String applicationName) {
        return new TemplateContext(() -> locale, () -> applicationName);
    }

    /** JVM default locale plus the {@value #APPLICATION_NAME_PROPERTY} system property. */
    public static TemplateContext defaults() {
        return new TemplateContext(Locale::getDefault, TemplateContext::applicationNameFromProperty);
    }

    /** RFC 3066 language tag of the current locale, e.g. {@code en-US}. */
    public String languageTag() {
        Locale l = locale.get();
        if (l == null) return "";
        String language = l.getLanguage();
        String country = l.getCountry();
        return country.isEmpty() ? language : language + "-" + country;
    }

    public String applicationName() {
        return Objects.toString(applicationName.get(), "");
    }

    private static String applicationNameFromProperty() {
        String name = System.getProperty(APPLICATION_NAME_PROPERTY);
        return (name == null || name.isBlank()) ? DEFAULT_APPLICATION_NAME : name.trim();
    }
}
