package com.purchasingpower.beanstalk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BeanstalkRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(BeanstalkRegistryApplication.class, args);
    }
}
