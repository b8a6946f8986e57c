package com.deliium.drawingboard.store;

import java.util.Optional;

/**
 * Account rows. Implementations signal failures with Spring's unchecked
 * {@link org.springframework.dao.DataAccessException} hierarchy; a duplicate email surfaces as
 * {@link org.springframework.dao.DuplicateKeyException}.
 */
public interface UserStore {

    long createUser(String email, String passwordHash);

    Optional<User> findUserByEmail(String email);

    Optional<User> findUserById(long id);
}
