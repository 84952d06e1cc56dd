package ru.perminov.ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.perminov.ledger.dto.UserDto;
import ru.perminov.ledger.dto.UserRequest;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.model.Account;
import ru.perminov.ledger.model.User;
import ru.perminov.ledger.repository.AccountRepository;
import ru.perminov.ledger.repository.UserRepository;
import ru.perminov.ledger.util.RequestChecks;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final AccountRepository accountRepository;
    private final AccountService accountService;

    @Transactional(readOnly = true)
    public List<UserDto> list() {
        return userRepository.findAllByOrderByLastNameAscFirstNameAsc().stream()
                .map(UserDto::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public UserDto get(Long id) {
        return UserDto.from(require(id));
    }

    @Transactional
    public UserDto create(UserRequest request) {
        User user = new User();
        apply(user, request);
        User saved = userRepository.save(user);
        log.info("User created: id={}, initials={}", saved.getId(), saved.getInitials());
        return UserDto.from(saved);
    }

    @Transactional
    public UserDto update(Long id, UserRequest request) {
        User user = require(id);
        apply(user, request);
        return UserDto.from(userRepository.save(user));
    }

    /**
     * Deletes the user and, through {@link AccountService#delete(Long)}, every account with its history.
     */
    @Transactional
    public void delete(Long id) {
        User user = require(id);
        List<Account> accounts = accountRepository.findByUserIdOrderByAccountTypeAsc(id);
        for (Account account : accounts) {
            accountService.delete(account.getId());
        }
        userRepository.delete(user);
        log.warn("User deleted: id={}, accountsRemoved={}", id, accounts.size());
    }

    User require(Long id) {
        return userRepository.findById(id).orElseThrow(() -> NotFoundException.of("User", id));
    }

    private void apply(User user, UserRequest request) {
        user.setInitials(RequestChecks.text(request.initials(), "Initials", 5));
        user.setFirstName(RequestChecks.text(request.firstName(), "First name", 30));
        user.setLastName(RequestChecks.text(request.lastName(), "Last name", 30));
        user.setProvider(RequestChecks.text(request.provider(), "Provider", 5));
    }
}
