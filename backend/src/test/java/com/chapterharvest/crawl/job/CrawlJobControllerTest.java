package com.chapterharvest.crawl.job;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlJobControllerTest {
    private final CrawlJobController controller = new CrawlJobController();

    @Test
    void secondJobIsRejectedWhileFirstIsActive() {
        controller.start("job-1");

        assertThatThrownBy(() -> controller.start("job-2")).isInstanceOf(ActiveCrawlJobException.class);
        assertThat(controller.status().activeJobId()).isEqualTo("job-1");
    }

    @Test
    void cancelledJobCanBeReplaced() {
        controller.start("job-1");
        controller.requestCancel();

        controller.start("job-2");

        assertThat(controller.status().activeJobId()).isEqualTo("job-2");
        assertThat(controller.isCancelled()).isFalse();
    }

    @Test
    void endOnlyClearsMatchingJob() {
        controller.start("job-1");
        controller.requestStop();

        controller.end("other");
        assertThat(controller.status().active()).isTrue();
        assertThat(controller.isStopped()).isTrue();

        controller.end("job-1");
        assertThat(controller.status().active()).isFalse();
        assertThat(controller.isStopped()).isFalse();
        controller.end("job-1");
    }

    @Test
    void cancelRaisesAtCheckpointWhileStopDoesNot() {
        controller.start("job-1");
        controller.requestStop();
        controller.raiseIfCancelled();

        controller.requestCancel();
        assertThatThrownBy(controller::raiseIfCancelled)
            .isInstanceOf(CrawlCancelledException.class)
            .hasMessage("Operation cancelled by user");
    }

    @Test
    void blankJobIdIsRejected() {
        assertThatThrownBy(() -> controller.start(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
