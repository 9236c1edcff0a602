package dev.marketbloom.controller;

import dev.marketbloom.config.OpenApiConfig;
import dev.marketbloom.dto.ContactRequest;
import dev.marketbloom.dto.ContactResponse;
import dev.marketbloom.service.SubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Public contact endpoint. Submission management is in {@link SubmissionController}.
 */
@RestController
@RequestMapping("/api/contact")
@Tag(name = "Contact", description = "Lead capture from the public contact form")
@SecurityRequirement(name = OpenApiConfig.API_KEY_SCHEME)
@RequiredArgsConstructor
@Slf4j
public class ContactController {

    private final SubmissionService submissionService;

    @PostMapping
    @Operation(summary = "Submit contact form", description = "Stores the lead and notifies the sales inbox")
    public Mono<ContactResponse> submit(@Valid @RequestBody(required = false) ContactRequest request) {
        if (request == null) {
            // an absent body is a form with every field missing
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, ContactRequest.REQUIRED_FIELDS_MESSAGE));
        }
        log.debug("Received contact submission for service: {}", request.getService());
        return submissionService.createSubmission(request)
                .map(ContactResponse::of);
    }
}
