package com.carrental.rental.service;

import com.carrental.rental.access.Actor;
import com.carrental.rental.constants.ValidationMessages;
import com.carrental.rental.exception.RentalValidationException;
import com.carrental.rental.exception.ResourceNotFoundException;
import com.carrental.rental.model.User;
import com.carrental.rental.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;

    /**
     * Builds the actor for an already-authenticated user id. The role always comes from
     * the stored account, never from the caller.
     */
    @Transactional(readOnly = true)
    public Actor resolveActor(Long userId) {
        if (userId == null) {
            throw new RentalValidationException(ValidationMessages.USER_ID_REQUIRED);
        }
        User user = findUserOrThrow(userId);
        log.debug("Resolved actor: userId={}, role={}", userId, user.getRole());
        return new Actor(user.getId(), user.getRole());
    }

    public User findUserOrThrow(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.user(userId));
    }

    public User findByEmailOrThrow(String email) {
        return userRepository.findByEmailIgnoreCase(email.trim())
                .orElseThrow(() -> ResourceNotFoundException.userByEmail(email));
    }
}
