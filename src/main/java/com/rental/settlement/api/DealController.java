package com.rental.settlement.api;

import com.rental.settlement.core.DealStateMachine;
import com.rental.settlement.domain.ActingUser;
import com.rental.settlement.domain.DealView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for two-sided deal confirmation.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/deals")
@RequiredArgsConstructor
@Tag(name = "Deals", description = "Confirm, query and cancel rental deals")
public class DealController {

    private final DealStateMachine dealStateMachine;

    @PostMapping("/conversations/{conversationId}/owner-confirm")
    @PreAuthorize("hasRole('OWNER')")
    @Operation(summary = "Owner confirms the deal",
            description = "Creates the deal for the conversation if needed and records the owner's confirmation. "
                    + "agreedRent, when given, replaces the stored rent. The deal completes once the tenant has confirmed too; "
                    + "confirming a completed deal returns it unchanged.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Deal after confirmation",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = DealView.class))),
            @ApiResponse(responseCode = "400", description = "Deal cancelled (INVALID_DEAL_STATUS) or invalid rent"),
            @ApiResponse(responseCode = "403", description = "Caller is not an owner"),
            @ApiResponse(responseCode = "404", description = "Conversation not found for this owner (CONVERSATION_NOT_FOUND)")
    })
    public ResponseEntity<DealView> ownerConfirm(@PathVariable String conversationId,
                                                 @Valid @RequestBody(required = false) AgreedRentRequestDto body,
                                                 @AuthenticationPrincipal Jwt jwt) {
        Integer agreedRent = body != null ? body.getAgreedRent() : null;
        return ResponseEntity.ok(dealStateMachine.ownerConfirm(conversationId, jwt.getSubject(), agreedRent));
    }

    @PostMapping("/conversations/{conversationId}/tenant-confirm")
    @PreAuthorize("hasRole('TENANT')")
    @Operation(summary = "Tenant confirms the deal",
            description = "Creates the deal for the conversation if needed and records the tenant's confirmation.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Deal after confirmation",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = DealView.class))),
            @ApiResponse(responseCode = "400", description = "Deal cancelled (INVALID_DEAL_STATUS)"),
            @ApiResponse(responseCode = "403", description = "Caller is not a tenant"),
            @ApiResponse(responseCode = "404", description = "Conversation not found for this tenant (CONVERSATION_NOT_FOUND)")
    })
    public ResponseEntity<DealView> tenantConfirm(@PathVariable String conversationId, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(dealStateMachine.tenantConfirm(conversationId, jwt.getSubject()));
    }

    @PostMapping("/conversations/{conversationId}")
    @Operation(summary = "Get or create the deal of a conversation",
            description = "Either party may call this. A new deal starts in PENDING_BOTH with agreedRent, or the property's listed rent.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Existing or new deal",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = DealView.class))),
            @ApiResponse(responseCode = "404", description = "Conversation not found for this user (CONVERSATION_NOT_FOUND)")
    })
    public ResponseEntity<DealView> getOrCreate(@PathVariable String conversationId,
                                                @Valid @RequestBody(required = false) AgreedRentRequestDto body,
                                                @AuthenticationPrincipal Jwt jwt) {
        Integer agreedRent = body != null ? body.getAgreedRent() : null;
        return ResponseEntity.ok(dealStateMachine.getOrCreateDeal(conversationId, jwt.getSubject(), agreedRent));
    }

    @GetMapping("/conversations/{conversationId}")
    @Operation(summary = "Deal of a conversation", description = "Returns 200 with an empty body when the caller has no deal for it.")
    public ResponseEntity<DealView> getByConversation(@PathVariable String conversationId, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(dealStateMachine.getDealByConversation(conversationId, jwt.getSubject()).orElse(null));
    }

    @GetMapping
    @Operation(summary = "Deals of the caller",
            description = "Owners get the deals of their properties, everybody else the deals they rent under. Newest first.")
    public ResponseEntity<List<DealView>> getUserDeals(@AuthenticationPrincipal Jwt jwt) {
        ActingUser user = AuthenticatedUsers.from(jwt);
        return ResponseEntity.ok(dealStateMachine.getUserDeals(user.getUserId(), user.getRole()));
    }

    @PostMapping("/{dealId}/cancel")
    @PreAuthorize("hasAnyRole('OWNER', 'TENANT')")
    @Operation(summary = "Cancel a deal", description = "Either party may cancel until the deal completes. Cancelling twice is acknowledged.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Cancelled deal",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = DealView.class))),
            @ApiResponse(responseCode = "404", description = "No such deal for this user (DEAL_NOT_FOUND)"),
            @ApiResponse(responseCode = "409", description = "Deal already completed (DEAL_ALREADY_COMPLETED)")
    })
    public ResponseEntity<DealView> cancel(@PathVariable String dealId, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(dealStateMachine.cancelDeal(dealId, jwt.getSubject()));
    }
}
