package com.sharesgate.access;

import com.sharesgate.common.Addresses;
import com.sharesgate.config.CaffeineConfig;
import com.sharesgate.domain.Community;
import com.sharesgate.domain.CommunityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.cache.annotation.Caching;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Registration and lookup of gated communities. Lookups by subject and by chat are cached; misses are not.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CommunityService {

    private final CommunityRepository communityRepository;
    private final AccessProperties accessProperties;

    @Cacheable(cacheNames = CaffeineConfig.COMMUNITY_BY_SUBJECT_CACHE, key = "#chainType + ':' + #subjectAddress", unless = "#result == null")
    public Optional<Community> findBySubject(String subjectAddress, String chainType) {
        return communityRepository.findFirstBySubjectAddressAndChainType(Addresses.normalize(subjectAddress), chainType);
    }

    @Cacheable(cacheNames = CaffeineConfig.COMMUNITY_BY_CHAT_CACHE, key = "#chainType + ':' + #chatGroupId", unless = "#result == null")
    public Optional<Community> findByChat(String chatGroupId, String chainType) {
        return communityRepository.findFirstByChatGroupIdAndChainType(chatGroupId, chainType);
    }

    public Optional<Community> findByAgentName(String agentName) {
        return communityRepository.findById(agentName);
    }

    /**
     * Newest first; {@code page} is one-based.
     */
    public Page<Community> list(int page, int pageSize) {
        return communityRepository.findAll(PageRequest.of(page - 1, pageSize, Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException when the agent name is taken
     */
    @Caching(evict = {
            @CacheEvict(cacheNames = CaffeineConfig.COMMUNITY_BY_SUBJECT_CACHE, allEntries = true),
            @CacheEvict(cacheNames = CaffeineConfig.COMMUNITY_BY_CHAT_CACHE, allEntries = true)
    })
    public Community register(CommunityRegistration registration) {
        Community community = new Community();
        community.setAgentName(registration.agentName().trim());
        community.setBio(registration.bio());
        community.setInviteUrl(registration.inviteUrl());
        community.setBotToken(registration.botToken());
        community.setChatGroupId(registration.chatGroupId().trim());
        community.setSubjectAddress(Addresses.normalize(registration.subjectAddress()));
        community.setChainType(registration.chainType() == null || registration.chainType().isBlank()
                ? accessProperties.getDefaultChainType()
                : registration.chainType().trim());
        community.setCreatedAt(Instant.now());
        Community saved = communityRepository.insert(community);
        log.info("Registered community {} for subject {} on {}", saved.getAgentName(), saved.getSubjectAddress(), saved.getChainType());
        return saved;
    }
}
