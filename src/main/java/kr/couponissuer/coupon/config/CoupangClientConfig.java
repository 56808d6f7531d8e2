package kr.couponissuer.coupon.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import lombok.RequiredArgsConstructor;
import kr.couponissuer.coupon.service.Sleeper;

@Configuration
@RequiredArgsConstructor
public class CoupangClientConfig {

    private final IssuerProperties properties;

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(properties.getTimeZone()));
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    public RestClient coupangRestClient(RestClient.Builder builder) {
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(properties.getCoupang().getConnectTimeout())
                .withReadTimeout(properties.getCoupang().getReadTimeout());

        return builder
                .requestFactory(ClientHttpRequestFactories.get(settings))
                .build();
    }
}
