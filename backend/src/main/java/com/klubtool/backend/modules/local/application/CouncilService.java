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
import com.klubtool.backend.modules.local.domain.Council;
import com.klubtool.backend.modules.local.domain.Local;
import com.klubtool.backend.modules.local.infrastructure.persistence.CouncilRepository;
import com.klubtool.backend.modules.local.infrastructure.persistence.LocalRepository;
import com.klubtool.backend.modules.local.presentation.dto.CouncilRequest;
import com.klubtool.backend.modules.local.presentation.dto.CouncilResponse;
import com.klubtool.backend.modules.local.presentation.dto.UpdateCouncilRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class CouncilService {

    private final CouncilRepository councilRepository;
    private final LocalRepository localRepository;
    private final MembershipResolver membershipResolver;
    private final AccessDecisionService accessDecisionService;

    public CouncilService(
            CouncilRepository councilRepository,
            LocalRepository localRepository,
            MembershipResolver membershipResolver,
            AccessDecisionService accessDecisionService
    ) {
        this.councilRepository = councilRepository;
        this.localRepository = localRepository;
        this.membershipResolver = membershipResolver;
        this.accessDecisionService = accessDecisionService;
    }

    @Transactional(readOnly = true)
    public List<CouncilResponse> listCouncils() {
        MembershipContext context = membershipResolver.resolveCurrentUser();
        accessDecisionService.require(context, AccessAction.LIST, AccessTarget.of(ResourceType.COUNCIL));
        return councilRepository.findAllOrderByName().stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public CouncilResponse getCouncil(UUID councilId) {
        Council council = loadCouncil(councilId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(council));
        return toResponse(council);
    }

    public CouncilResponse createCouncil(CouncilRequest request) {
        Local local = localRepository.findById(request.localId())
                .orElseThrow(() -> ProblemException.notFound("LOCAL_NOT_FOUND"));
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.CREATE,
                AccessTarget.of(ResourceType.COUNCIL).withLocal(local.getId()));
        if (councilRepository.existsByLocal_Id(local.getId())) {
            throw ProblemException.conflict("LOCAL_ALREADY_HAS_COUNCIL");
        }
        Council council = new Council();
        council.setName(request.name().trim());
        council.setLocal(local);
        council.setCalendarBadgeName(trimToNull(request.calendarBadgeName()));
        return toResponse(councilRepository.save(council));
    }

    public CouncilResponse updateCouncil(UUID councilId, UpdateCouncilRequest request) {
        Council council = loadCouncil(councilId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(council));
        if (request.name() != null && !request.name().isBlank()) {
            council.setName(request.name().trim());
        }
        if (request.calendarBadgeName() != null) {
            council.setCalendarBadgeName(trimToNull(request.calendarBadgeName()));
        }
        if (request.active() != null) {
            council.setActive(request.active());
        }
        return toResponse(council);
    }

    public void deleteCouncil(UUID councilId) {
        Council council = loadCouncil(councilId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.DELETE,
                targetOf(council));
        councilRepository.delete(council);
    }

    private Council loadCouncil(UUID councilId) {
        return councilRepository.findWithLocalById(councilId)
                .orElseThrow(() -> ProblemException.notFound("COUNCIL_NOT_FOUND"));
    }

    private static AccessTarget targetOf(Council council) {
        return AccessTarget.of(ResourceType.COUNCIL)
                .withCouncil(council.getId())
                .withLocal(council.getLocal().getId());
    }

    private CouncilResponse toResponse(Council council) {
        return new CouncilResponse(
                council.getId(),
                council.getName(),
                council.getLocal().getId(),
                council.getLocal().getName(),
                council.getCalendarBadgeName(),
                council.isActive()
        );
    }
}
