package com.tcgptracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the TCGP Tracker.
 *
 * The tracker records which cards of each set a user owns, shows progress per set and
 * rarity, and estimates which booster pack is most likely to yield a new card.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TcgpTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TcgpTrackerApplication.class, args);
    }
}
