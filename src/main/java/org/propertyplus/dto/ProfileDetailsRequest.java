package org.propertyplus.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfileDetailsRequest {
    @NotBlank
    private String password;
    @Size(max = 20)
    private String contactNumber;
    @Size(max = 100)
    private String city;
    @Size(max = 100)
    private String state;
}
