package com.merchandise.inventory.dto.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * New inventory count session; the first grid row is the header
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

    private String title;
    private String supplier;
    private String category;

    @NotEmpty(message = "Grid must contain at least a header row.")
    private List<List<String>> grid;
}
