package com.theatre.reservation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication(scanBasePackages = {"com.theatre.reservation", "com.theatre.common.web"})
@EnableJpaRepositories(basePackages = {"com.theatre.reservation.repository"})
@EntityScan(basePackages = {"com.theatre.common.entity"})
@EnableTransactionManagement
@EnableKafka
public class ReservationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReservationServiceApplication.class, args);
    }
}
