package com.bidradar.crawl.util;

import com.bidradar.crawl.model.CandidateRecord;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OpportunityIdentityTest {

    @Test
    void identicalTuplesHashToSameId() {
        String first = OpportunityIdentity.stableId("src", "https://x.test/1", "Title", "March 4, 2025");
        String second = OpportunityIdentity.stableId("src", "https://x.test/1", "Title", "March 4, 2025");

        assertThat(first).isEqualTo(second).hasSize(64).matches("[0-9a-f]{64}");
    }

    @Test
    void anyFieldChangeYieldsNewId() {
        String base = OpportunityIdentity.stableId("src", "https://x.test/1", "Title", "March 4, 2025");

        assertThat(OpportunityIdentity.stableId("src2", "https://x.test/1", "Title", "March 4, 2025")).isNotEqualTo(base);
        assertThat(OpportunityIdentity.stableId("src", "https://x.test/2", "Title", "March 4, 2025")).isNotEqualTo(base);
        assertThat(OpportunityIdentity.stableId("src", "https://x.test/1", "Title v2", "March 4, 2025")).isNotEqualTo(base);
        assertThat(OpportunityIdentity.stableId("src", "https://x.test/1", "Title", "2025-03-04")).isNotEqualTo(base);
    }

    @Test
    void hashesPipeJoinedRawTupleWithEmptyDeadline() {
        CandidateRecord candidate = new CandidateRecord(
            null, "src", "Title", "https://x.test/1", "Org", "type", "region", null, null, "", null
        );

        assertThat(OpportunityIdentity.stableId(candidate))
            .isEqualTo(OpportunityIdentity.sha256Hex("src|https://x.test/1|Title|"));
    }
}
