package dev.marketbloom.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A stored contact-form lead. Rows are written once by the contact endpoint and
 * never updated; {@code timestamp} and {@code status} come from column defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("submissions")
public class Submission {

    public static final String DEFAULT_STATUS = "new";

    @Id
    private Long id;

    private String name;

    private String business;

    private String service;

    private String phone;

    @Builder.Default
    private String message = "";

    @Column("timestamp")
    private LocalDateTime timestamp;

    @Builder.Default
    private String status = DEFAULT_STATUS;
}
