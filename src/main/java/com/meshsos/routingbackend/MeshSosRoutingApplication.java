package com.meshsos.routingbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeshSosRoutingApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeshSosRoutingApplication.class, args);
    }

}
