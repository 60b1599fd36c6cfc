package roadwatch.compute.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import roadwatch.compute.service.StreamOrchestrator;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StreamSocketControllerTest {

    @Mock
    private StreamOrchestrator orchestrator;

    @InjectMocks
    private StreamSocketController controller;

    @Test
    void startAndStopMessages_ShouldDriveTheStream() {
        controller.startStream();
        controller.stopStream();

        verify(orchestrator).start();
        verify(orchestrator).stop();
        verifyNoMoreInteractions(orchestrator);
    }
}
