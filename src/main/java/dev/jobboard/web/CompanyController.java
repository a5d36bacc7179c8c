package dev.jobboard.web;

import dev.jobboard.model.CompanyRequest;
import dev.jobboard.model.CompanyResponse;
import dev.jobboard.model.CompanyVerificationRequest;
import dev.jobboard.model.PageResponse;
import dev.jobboard.service.CompanyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/companies")
@RequiredArgsConstructor
public class CompanyController {

    private final CompanyService companyService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<CompanyResponse> create(@ActingUser Long actorId,
            @Valid @RequestBody CompanyRequest request) {
        return Requests.call(() -> companyService.create(actorId, request));
    }

    @GetMapping
    public Mono<PageResponse<CompanyResponse>> list(
            @RequestParam(required = false) Boolean verified,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return Requests.call(() -> companyService.list(verified, page, size));
    }

    @GetMapping("/{companyId}")
    public Mono<CompanyResponse> get(@PathVariable Long companyId) {
        return Requests.call(() -> companyService.get(companyId));
    }

    @PutMapping("/{companyId}")
    public Mono<CompanyResponse> update(@ActingUser Long actorId,
            @PathVariable Long companyId, @Valid @RequestBody CompanyRequest request) {
        return Requests.call(() -> companyService.update(actorId, companyId, request));
    }

    @PutMapping("/{companyId}/verification")
    public Mono<CompanyResponse> setVerification(@ActingUser Long actorId,
            @PathVariable Long companyId, @Valid @RequestBody CompanyVerificationRequest request) {
        return Requests.call(() -> companyService.setVerification(actorId, companyId, request));
    }
}
