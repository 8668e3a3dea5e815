package com.liquidation.heatmap.infra.binance.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.TimeUnit;

@Configuration
public class OkHttpConfig {

    @Bean
    @Primary
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(0, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .pingInterval(20, TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    /** REST calls share the connection pool but get a bounded read and overall call timeout. */
    @Bean
    public OkHttpClient binanceRestHttpClient(OkHttpClient okHttpClient, BinanceProperties properties) {
        return okHttpClient.newBuilder()
                .readTimeout(properties.getRestCallTimeoutMs(), TimeUnit.MILLISECONDS)
                .callTimeout(properties.getRestCallTimeoutMs(), TimeUnit.MILLISECONDS)
                .pingInterval(0, TimeUnit.SECONDS)
                .build();
    }
}
