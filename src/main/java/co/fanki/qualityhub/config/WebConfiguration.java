package co.fanki.qualityhub.config;

import co.fanki.qualityhub.project.application.ProjectAccessInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * MVC configuration: registers the project tenancy check.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class WebConfiguration implements WebMvcConfigurer {

    private final ProjectAccessInterceptor projectAccessInterceptor;

    /**
     * Creates a new WebConfiguration.
     *
     * @param theProjectAccessInterceptor the project tenancy interceptor
     */
    public WebConfiguration(
            final ProjectAccessInterceptor theProjectAccessInterceptor) {
        this.projectAccessInterceptor = theProjectAccessInterceptor;
    }

    @Override
    public void addInterceptors(final InterceptorRegistry registry) {
        registry.addInterceptor(projectAccessInterceptor)
                .addPathPatterns("/api/v1/projects/*", "/api/v1/projects/*/**");
    }

}
