package com.tapas.rollup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;


@EnableKafka
@SpringBootApplication
public class RollupServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RollupServiceApplication.class, args);
    }
}
