package com.bikerly.config;

import com.bikerly.shared.model.Role;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

/**
 * Mongo mapping: roles are stored by their lower-case value and audit timestamps are filled in on save.
 * An unknown stored role fails the read instead of reaching a role comparison.
 */
@Configuration
@EnableMongoAuditing
public class MongoConfig {

    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(new RoleWritingConverter(), new RoleReadingConverter()));
    }

    @WritingConverter
    static class RoleWritingConverter implements Converter<Role, String> {
        @Override
        public String convert(Role source) {
            return source.getValue();
        }
    }

    @ReadingConverter
    static class RoleReadingConverter implements Converter<String, Role> {
        @Override
        public Role convert(String source) {
            return Role.fromValue(source);
        }
    }
}
