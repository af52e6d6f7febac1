/**
 * URL template expansion for OpenSearch {@code Url} templates and parameters.
 *
 * <p>Pure string work with no state beyond the {@link ai.attackframework.tools.searchengine.template.TemplateContext};
 * safe to call from any thread.</p>
 */
package ai.attackframework.tools.searchengine.template;
