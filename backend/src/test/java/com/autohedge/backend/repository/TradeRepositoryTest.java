package com.autohedge.backend.repository;

import com.autohedge.backend.model.Trade;
import com.autohedge.backend.model.TradeStatus;
import com.autohedge.backend.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class TradeRepositoryTest {

    @Autowired
    private TradeRepository tradeRepository;

    @Autowired
    private UserRepository userRepository;

    private String userId;
    private final List<String> newestFirst = new ArrayList<>();

    private String newUser() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return userRepository.save(User.builder()
                .username("paging_" + suffix)
                .email("paging_" + suffix + "@example.com")
                .fundName("Paging Fund")
                .build()).getId();
    }

    @BeforeEach
    void setUp() {
        userId = newUser();
        Instant base = Instant.parse("2026-03-02T14:00:00Z");
        for (int i = 0; i < 5; i++) {
            Trade trade = tradeRepository.save(Trade.builder()
                    .userId(userId)
                    .stocks(List.of("SYM" + i))
                    .task("Evaluate trade number " + i)
                    .allocation(new BigDecimal("1000.0000"))
                    .riskLevel(5)
                    .status(i % 2 == 0 ? TradeStatus.COMPLETED : TradeStatus.FAILED)
                    .createdAt(base.plusSeconds(i))
                    .build());
            newestFirst.add(0, trade.getId());
        }
        // Another user's trade must never leak into the page.
        tradeRepository.saveAndFlush(Trade.builder()
                .userId(newUser())
                .stocks(List.of("OTHER"))
                .task("Someone else's trade")
                .allocation(new BigDecimal("1.0000"))
                .riskLevel(1)
                .status(TradeStatus.COMPLETED)
                .createdAt(base.plusSeconds(60))
                .build());
    }

    @Test
    void pagesByOffsetInTheDatabase() {
        List<Trade> page = tradeRepository.findByUserIdOrderByCreatedAtDesc(userId, new OffsetPageRequest(1, 3));

        assertThat(page).extracting(Trade::getId).containsExactlyElementsOf(newestFirst.subList(1, 4));
    }

    @Test
    void offsetPastTheEndIsEmpty() {
        assertThat(tradeRepository.findByUserIdOrderByCreatedAtDesc(userId, new OffsetPageRequest(10, 5))).isEmpty();
    }

    @Test
    void statusFilterAppliesBeforeOffset() {
        List<Trade> page = tradeRepository.findByUserIdAndStatusOrderByCreatedAtDesc(
                userId, TradeStatus.COMPLETED, new OffsetPageRequest(1, 10));

        assertThat(page).extracting(Trade::getId).containsExactly(newestFirst.get(2), newestFirst.get(4));
    }

    @Test
    void offsetNotAlignedToPageSizeIsKept() {
        OffsetPageRequest request = new OffsetPageRequest(7, 3);

        assertThat(request.getOffset()).isEqualTo(7);
        assertThat(request.getPageNumber()).isEqualTo(2);
        assertThat(request.next().getOffset()).isEqualTo(10);
        assertThat(request.previousOrFirst().getOffset()).isEqualTo(4);
        assertThatThrownBy(() -> new OffsetPageRequest(-1, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OffsetPageRequest(0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
