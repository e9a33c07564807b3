package com.streamsync.watchparty;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WatchPartyApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatchPartyApplication.class, args);
    }
}
