package com.bikerly.shared.repository;

import com.bikerly.shared.model.User;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for User documents.
 */
@Repository
public interface UserRepository extends MongoRepository<User, String> {

    /**
     * Find a user by email (the login identifier and token subject).
     * @param email the email address
     * @return Optional containing the User if found
     */
    Optional<User> findByEmail(String email);
}
