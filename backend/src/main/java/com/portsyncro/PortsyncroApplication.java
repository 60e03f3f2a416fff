package com.portsyncro;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortsyncroApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortsyncroApplication.class, args);
    }
}
