package com.klubtool.backend.modules.local.application;

import static com.klubtool.backend.global.common.TextValues.trimToNull;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessTarget;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.access.domain.ResourceType;
import com.klubtool.backend.modules.local.domain.Local;
import com.klubtool.backend.modules.local.domain.Party;
import com.klubtool.backend.modules.local.infrastructure.persistence.LocalRepository;
import com.klubtool.backend.modules.local.infrastructure.persistence.PartyRepository;
import com.klubtool.backend.modules.local.presentation.dto.LocalRequest;
import com.klubtool.backend.modules.local.presentation.dto.LocalResponse;
import com.klubtool.backend.modules.local.presentation.dto.PartyRequest;
import com.klubtool.backend.modules.local.presentation.dto.PartyResponse;
import com.klubtool.backend.modules.local.presentation.dto.UpdateLocalRequest;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Locals and the parties registered with them. Parties follow the access rules of their local.
 */
@Service
@Transactional
public class LocalService {

    private final LocalRepository localRepository;
    private final PartyRepository partyRepository;
    private final MembershipResolver membershipResolver;
    private final AccessDecisionService accessDecisionService;

    public LocalService(
            LocalRepository localRepository,
            PartyRepository partyRepository,
            MembershipResolver membershipResolver,
            AccessDecisionService accessDecisionService
    ) {
        this.localRepository = localRepository;
        this.partyRepository = partyRepository;
        this.membershipResolver = membershipResolver;
        this.accessDecisionService = accessDecisionService;
    }

    @Transactional(readOnly = true)
    public List<LocalResponse> listLocals() {
        MembershipContext context = membershipResolver.resolveCurrentUser();
        accessDecisionService.require(context, AccessAction.LIST, AccessTarget.of(ResourceType.LOCAL));
        return localRepository.findAllByOrderByNameAsc().stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public LocalResponse getLocal(UUID localId) {
        Local local = loadLocal(localId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(local));
        return toResponse(local);
    }

    public LocalResponse createLocal(LocalRequest request) {
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.CREATE,
                AccessTarget.of(ResourceType.LOCAL));
        String name = request.name().trim();
        String code = request.code().trim();
        ensureUniqueName(name);
        ensureUniqueCode(code);

        Local local = new Local();
        local.setName(name);
        local.setCode(code);
        local.setDescription(trimToNull(request.description()));
        local.setActive(request.active() == null || request.active());
        return toResponse(localRepository.save(local));
    }

    public LocalResponse updateLocal(UUID localId, UpdateLocalRequest request) {
        Local local = loadLocal(localId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(local));

        if (request.name() != null && !request.name().trim().equalsIgnoreCase(local.getName())) {
            String name = request.name().trim();
            ensureUniqueName(name);
            local.setName(name);
        }
        if (request.code() != null && !request.code().trim().equalsIgnoreCase(local.getCode())) {
            String code = request.code().trim();
            ensureUniqueCode(code);
            local.setCode(code);
        }
        if (request.description() != null) {
            local.setDescription(trimToNull(request.description()));
        }
        if (request.active() != null) {
            local.setActive(request.active());
        }
        return toResponse(local);
    }

    public void deleteLocal(UUID localId) {
        Local local = loadLocal(localId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.DELETE, targetOf(local));
        localRepository.delete(local);
    }

    @Transactional(readOnly = true)
    public List<PartyResponse> listParties(UUID localId) {
        Local local = loadLocal(localId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(local));
        return partyRepository.findByLocal_IdOrderByNameAsc(local.getId()).stream()
                .map(this::toResponse)
                .toList();
    }

    public PartyResponse createParty(UUID localId, PartyRequest request) {
        Local local = loadLocal(localId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(local));
        Party party = new Party();
        party.setName(request.name().trim());
        party.setShortName(trimToNull(request.shortName()));
        party.setLocal(local);
        return toResponse(partyRepository.save(party));
    }

    private Local loadLocal(UUID localId) {
        return localRepository.findById(localId)
                .orElseThrow(() -> ProblemException.notFound("LOCAL_NOT_FOUND"));
    }

    private void ensureUniqueName(String name) {
        if (localRepository.existsByNameIgnoreCase(name)) {
            throw new ProblemException(HttpStatus.CONFLICT, "LOCAL_NAME_TAKEN");
        }
    }

    private void ensureUniqueCode(String code) {
        if (localRepository.existsByCodeIgnoreCase(code)) {
            throw new ProblemException(HttpStatus.CONFLICT, "LOCAL_CODE_TAKEN");
        }
    }

    private static AccessTarget targetOf(Local local) {
        return AccessTarget.of(ResourceType.LOCAL).withLocal(local.getId());
    }

    private LocalResponse toResponse(Local local) {
        return new LocalResponse(
                local.getId(),
                local.getName(),
                local.getCode(),
                local.getDescription(),
                local.isActive(),
                local.getCreatedAt(),
                local.getUpdatedAt()
        );
    }

    private PartyResponse toResponse(Party party) {
        return new PartyResponse(
                party.getId(),
                party.getName(),
                party.getShortName(),
                party.getLocal() == null ? null : party.getLocal().getId(),
                party.isActive()
        );
    }
}
