package com.example.rentalchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RentalChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(RentalChatApplication.class, args);
    }
}
