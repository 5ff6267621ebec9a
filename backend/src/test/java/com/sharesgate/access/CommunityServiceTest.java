package com.sharesgate.access;

import com.sharesgate.config.CaffeineConfig;
import com.sharesgate.domain.Community;
import com.sharesgate.domain.CommunityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.cache.CacheManager;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        CommunityService.class,
        AccessProperties.class
})
class CommunityServiceTest {

    @Autowired
    CommunityService communityService;
    @Autowired
    CacheManager cacheManager;

    @MockBean
    CommunityRepository communityRepository;

    @BeforeEach
    void clearCaches() {
        cacheManager.getCacheNames().forEach(name -> cacheManager.getCache(name).clear());
    }

    @Test
    @DisplayName("lookups by chat are cached, misses are not")
    void findByChat_cachesHitsOnly() {
        Community community = community("agent-1");
        when(communityRepository.findFirstByChatGroupIdAndChainType("-100", "monad")).thenReturn(Optional.of(community));
        when(communityRepository.findFirstByChatGroupIdAndChainType("-200", "monad")).thenReturn(Optional.empty());

        assertThat(communityService.findByChat("-100", "monad")).contains(community);
        assertThat(communityService.findByChat("-100", "monad")).contains(community);
        assertThat(communityService.findByChat("-200", "monad")).isEmpty();
        assertThat(communityService.findByChat("-200", "monad")).isEmpty();

        verify(communityRepository, times(1)).findFirstByChatGroupIdAndChainType("-100", "monad");
        verify(communityRepository, times(2)).findFirstByChatGroupIdAndChainType("-200", "monad");
    }

    @Test
    void findBySubject_normalizesAddress() {
        when(communityRepository.findFirstBySubjectAddressAndChainType("bb", "monad")).thenReturn(Optional.of(community("agent-1")));

        assertThat(communityService.findBySubject("0xBB", "monad")).isPresent();
    }

    @Test
    @DisplayName("registration normalizes the subject, defaults the chain and evicts cached lookups")
    void register_normalizesAndEvicts() {
        when(communityRepository.findFirstByChatGroupIdAndChainType("-100", "monad")).thenReturn(Optional.of(community("agent-1")));
        when(communityRepository.insert(any(Community.class))).thenAnswer(inv -> inv.getArgument(0));
        communityService.findByChat("-100", "monad");

        Community saved = communityService.register(new CommunityRegistration(
                " agent-2 ", "bio", "https://t.me/+x", "1:tok", " -100 ", "0xABCD", null));
        communityService.findByChat("-100", "monad");

        assertThat(saved.getAgentName()).isEqualTo("agent-2");
        assertThat(saved.getSubjectAddress()).isEqualTo("abcd");
        assertThat(saved.getChainType()).isEqualTo("monad");
        assertThat(saved.getChatGroupId()).isEqualTo("-100");
        assertThat(saved.getCreatedAt()).isNotNull();
        verify(communityRepository, times(2)).findFirstByChatGroupIdAndChainType("-100", "monad");
    }

    @Test
    void list_isOneBasedNewestFirst() {
        when(communityRepository.findAll(any(Pageable.class))).thenReturn(new PageImpl<>(List.of()));

        communityService.list(2, 10);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(communityRepository).findAll(pageable.capture());
        assertThat(pageable.getValue()).isEqualTo(PageRequest.of(1, 10, Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    private static Community community(String name) {
        Community community = new Community();
        community.setAgentName(name);
        community.setChatGroupId("-100");
        community.setSubjectAddress("bb");
        community.setChainType("monad");
        return community;
    }
}
