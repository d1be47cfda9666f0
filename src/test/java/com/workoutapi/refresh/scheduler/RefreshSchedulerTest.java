package com.workoutapi.refresh.scheduler;

import com.workoutapi.refresh.exception.RefreshInProgressException;
import com.workoutapi.refresh.exception.RefreshSessionException;
import com.workoutapi.refresh.service.ExerciseRefreshService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RefreshSchedulerTest {

    @Mock
    private ExerciseRefreshService refreshService;

    @InjectMocks
    private RefreshScheduler refreshScheduler;

    @Test
    void testScheduledRefresh_SkipsTickWhileRunInProgress() {
        when(refreshService.refreshAll()).thenThrow(new RefreshInProgressException());

        assertDoesNotThrow(() -> refreshScheduler.scheduledRefresh());
        verify(refreshService, times(1)).refreshAll();
    }

    @Test
    void testScheduledRefresh_SessionFailureIsLogged() {
        when(refreshService.refreshAll())
                .thenThrow(new RefreshSessionException("no client", new IllegalArgumentException("bad url")));

        assertDoesNotThrow(() -> refreshScheduler.scheduledRefresh());
    }
}
