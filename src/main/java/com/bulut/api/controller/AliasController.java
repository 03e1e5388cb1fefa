package com.bulut.api.controller;

import com.bulut.alias.AliasRegistry;
import com.bulut.alias.DeleteOutcome;
import com.bulut.alias.RegistrationResult;
import com.bulut.api.dto.AliasResponse;
import com.bulut.api.dto.AliasSearchResponse;
import com.bulut.api.dto.MessageResponse;
import com.bulut.api.dto.RegisterAliasRequest;
import com.bulut.api.dto.ReverseAliasResponse;
import com.bulut.common.AddressCodec;
import com.bulut.common.exception.AuthorizationException;
import com.bulut.common.exception.ConflictException;
import com.bulut.common.exception.ErrorCode;
import com.bulut.common.exception.NotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for the alias directory.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "Aliases", description = "Alias directory API")
public class AliasController {

    private final AliasRegistry aliasRegistry;

    @PostMapping("/alias/register")
    @Operation(summary = "Bind an alias to a wallet address")
    public ResponseEntity<AliasResponse> register(@Valid @RequestBody RegisterAliasRequest request) {
        RegistrationResult result = aliasRegistry.register(
            request.getAlias(),
            request.getAddress(),
            request.getSignature()
        );

        String alias = AddressCodec.display(AddressCodec.normalizeAlias(request.getAlias()));
        return switch (result.getStatus()) {
            case REGISTERED -> ResponseEntity.status(HttpStatus.CREATED).body(AliasResponse.from(result.getRecord()));
            case ALIAS_TAKEN -> throw new ConflictException(ErrorCode.ALIAS_TAKEN, "Alias " + alias + " is already taken");
            case ADDRESS_ALREADY_ALIASED ->
                throw new ConflictException(ErrorCode.ADDRESS_ALREADY_ALIASED, "Address already has an alias");
            case INVALID_SIGNATURE -> throw new AuthorizationException(ErrorCode.INVALID_SIGNATURE);
        };
    }

    @GetMapping("/alias/search")
    @Operation(summary = "Find aliases by prefix")
    public ResponseEntity<AliasSearchResponse> search(@RequestParam(defaultValue = "") String query,
                                                      @RequestParam(defaultValue = "10") int limit) {
        List<AliasResponse> results = aliasRegistry.search(query, limit).stream()
            .map(AliasResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(new AliasSearchResponse(query, results.size(), results));
    }

    @GetMapping("/alias/{alias}")
    @Operation(summary = "Resolve an alias to its address")
    public ResponseEntity<AliasResponse> resolve(@PathVariable String alias) {
        String canonical = AddressCodec.normalizeAlias(alias);
        String address = aliasRegistry.resolve(canonical)
            .orElseThrow(() -> new NotFoundException(ErrorCode.ALIAS_NOT_FOUND, AddressCodec.display(canonical)));
        return ResponseEntity.ok(AliasResponse.builder()
            .alias(AddressCodec.display(canonical))
            .address(address)
            .build());
    }

    @GetMapping("/address/{address}/alias")
    @Operation(summary = "Get the alias bound to an address")
    public ResponseEntity<ReverseAliasResponse> reverseResolve(@PathVariable String address) {
        String canonical = AddressCodec.normalize(address);
        String alias = aliasRegistry.reverseResolve(canonical)
            .map(AddressCodec::display)
            .orElse(null);
        return ResponseEntity.ok(new ReverseAliasResponse(canonical, alias));
    }

    @DeleteMapping("/alias/{alias}")
    @Operation(summary = "Delete an alias (owner only)")
    public ResponseEntity<MessageResponse> delete(@PathVariable String alias,
                                                  @RequestHeader("X-Wallet-Address") String walletAddress,
                                                  @RequestHeader("X-Signature") String signature) {
        String display = AddressCodec.display(AddressCodec.normalizeAlias(alias));
        DeleteOutcome outcome = aliasRegistry.delete(alias, walletAddress, signature);
        return switch (outcome) {
            case DELETED -> ResponseEntity.ok(new MessageResponse(true, "Alias " + display + " deleted"));
            case NOT_FOUND -> throw new NotFoundException(ErrorCode.ALIAS_NOT_FOUND, display);
            case NOT_OWNER -> throw new AuthorizationException(ErrorCode.NOT_OWNER);
        };
    }
}
