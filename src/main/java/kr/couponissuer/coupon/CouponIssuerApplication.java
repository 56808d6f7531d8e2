package kr.couponissuer.coupon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CouponIssuerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CouponIssuerApplication.class, args)));
    }
}
