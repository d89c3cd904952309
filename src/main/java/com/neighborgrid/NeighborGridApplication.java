package com.neighborgrid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NeighborGridApplication {

    public static void main(String[] args) {
        SpringApplication.run(NeighborGridApplication.class, args);
    }
}
