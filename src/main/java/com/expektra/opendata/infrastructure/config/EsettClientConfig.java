package com.expektra.opendata.infrastructure.config;

import com.expektra.opendata.infrastructure.adapter.provider.EsettApi;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

import java.time.Clock;

@Configuration
public class EsettClientConfig {

    @Bean
    public OkHttpClient esettHttpClient(EsettProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getReadTimeout())
                .callTimeout(properties.getCallTimeout())
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    public EsettApi esettApi(OkHttpClient esettHttpClient, EsettProperties properties) {
        ObjectMapper jsonMapper = new ObjectMapper();
        jsonMapper.registerModule(new JavaTimeModule());
        jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(withTrailingSlash(properties.getBaseUrl()))
                .client(esettHttpClient)
                .addConverterFactory(JacksonConverterFactory.create(jsonMapper))
                .build();

        return retrofit.create(EsettApi.class);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static String withTrailingSlash(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }
}
