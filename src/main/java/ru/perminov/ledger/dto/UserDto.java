package ru.perminov.ledger.dto;

import lombok.Data;
import ru.perminov.ledger.model.User;

@Data
public class UserDto {
    private Long id;
    private String initials;
    private String firstName;
    private String lastName;
    private String provider;

    public static UserDto from(User user) {
        UserDto dto = new UserDto();
        dto.setId(user.getId());
        dto.setInitials(user.getInitials());
        dto.setFirstName(user.getFirstName());
        dto.setLastName(user.getLastName());
        dto.setProvider(user.getProvider());
        return dto;
    }
}
