package app.corvana.importer.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({CoreClientProps.class, ImportProps.class})
public class RestClientConfig {

    @Bean
    public RestClient coreRestClient(CoreClientProps props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        if (props.connectTimeoutMs() != null) {
            requestFactory.setConnectTimeout(props.connectTimeoutMs());
        }
        if (props.readTimeoutMs() != null) {
            requestFactory.setReadTimeout(props.readTimeoutMs());
        }
        return RestClient.builder()
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
