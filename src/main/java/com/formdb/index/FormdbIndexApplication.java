package com.formdb.index;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FormdbIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormdbIndexApplication.class, args);
    }
}
