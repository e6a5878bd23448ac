package com.ai.leasing.config;

import com.ai.leasing.entity.Property;
import com.ai.leasing.entity.Unit;
import com.ai.leasing.repository.PropertyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

@Configuration
@ConditionalOnProperty(name = "leasing.seed-sample-data", havingValue = "true")
public class DataSeeder {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    CommandLineRunner seedCatalogue(PropertyRepository propertyRepo, Clock clock) {
        return args -> {
            if (propertyRepo.count() > 0) {
                log.info("Catalogue already seeded, skipping");
                return;
            }
            LocalDate today = LocalDate.now(clock);

            Property property = Property.builder()
                    .name("Sample Residence")
                    .address("1 Herzl Street, Tel Aviv")
                    .description("Residential building with elevator and parking")
                    .contactPhone("+972500000000")
                    .contactEmail("leasing@example.com")
                    .build();
            property.addUnit(unit("A1", 3, "7500", 2, true, today));
            property.addUnit(unit("A2", 4, "9200", 3, true, today.plusWeeks(1)));
            property.addUnit(unit("B1", 2, "6200", 1, false, today));
            property.addUnit(unit("B2", 3, "8100", 4, true, today.plusWeeks(2)));

            propertyRepo.save(property);
            log.info("Seeded property '{}' with {} units", property.getName(), property.getUnits().size());
        };
    }

    private static Unit unit(String number, int rooms, String price, int floor, boolean parking, LocalDate availableFrom) {
        return Unit.builder()
                .unitNumber(number)
                .rooms(rooms)
                .price(new BigDecimal(price))
                .floor(floor)
                .hasParking(parking)
                .hasElevator(true)
                .status(Unit.Status.AVAILABLE)
                .availableFrom(availableFrom)
                .imageUrl("https://example.com/units/" + number.toLowerCase() + ".jpg")
                .build();
    }
}
