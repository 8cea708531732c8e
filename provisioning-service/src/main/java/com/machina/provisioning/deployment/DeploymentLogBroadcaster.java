package com.machina.provisioning.deployment;

import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentLogEntry;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.LogLevel;
import com.machina.provisioning.entity.LogSource;
import com.machina.provisioning.repository.DeploymentLogRepository;
import com.machina.provisioning.repository.DeploymentRepository;
import com.machina.provisioning.terraform.LogSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-deployment log buffer with push delivery to subscribers.
 *
 * Appends and subscriptions on one deployment are serialized on its channel, so a late
 * subscriber receives every buffered line, then every live line, with no gap and no
 * duplicate. Every line is persisted before it is delivered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeploymentLogBroadcaster {

    private final DeploymentLogRepository logRepository;
    private final DeploymentRepository deploymentRepository;

    private final Map<UUID, Channel> channels = new ConcurrentHashMap<>();

    public LogSink sinkFor(UUID deploymentId) {
        return (level, source, message) -> append(deploymentId, level, source, message);
    }

    public DeploymentLogLine append(UUID deploymentId, LogLevel level, LogSource source, String message) {
        Channel channel = channel(deploymentId);
        synchronized (channel) {
            DeploymentLogEntry entry = DeploymentLogEntry.builder()
                .deploymentId(deploymentId)
                .sequence(channel.nextSequence + 1)
                .timestamp(Instant.now())
                .level(level)
                .source(source)
                .message(message)
                .build();
            logRepository.save(entry);
            channel.nextSequence++;

            DeploymentLogLine line = DeploymentLogLine.from(entry);
            channel.buffer.add(line);
            List<DeploymentLogListener> failed = new ArrayList<>();
            for (DeploymentLogListener listener : channel.listeners) {
                try {
                    listener.onLog(line);
                } catch (Exception e) {
                    log.debug("Dropping log subscriber of deployment {}: {}", deploymentId, e.getMessage());
                    failed.add(listener);
                }
            }
            channel.listeners.removeAll(failed);
            return line;
        }
    }

    /**
     * Replay everything logged so far, then stream live lines until the deployment completes.
     * If it is already terminal the listener gets the replay followed by onComplete.
     */
    public Subscription subscribe(UUID deploymentId, DeploymentLogListener listener) {
        Channel channel = channel(deploymentId);
        synchronized (channel) {
            try {
                for (DeploymentLogLine line : channel.buffer) {
                    listener.onLog(line);
                }
                DeploymentState finalState = channel.finalState != null
                    ? channel.finalState
                    : terminalState(deploymentId).orElse(null);
                if (finalState != null) {
                    channel.finalState = finalState;
                    channels.remove(deploymentId, channel);
                    listener.onComplete(finalState);
                    return () -> { };
                }
            } catch (Exception e) {
                log.debug("Log subscriber of deployment {} failed during replay: {}", deploymentId, e.getMessage());
                return () -> { };
            }
            channel.listeners.add(listener);
        }
        return () -> unsubscribe(deploymentId, listener);
    }

    /**
     * Signal the end of the log. Must be called after the terminal state is committed.
     */
    public void complete(UUID deploymentId, DeploymentState finalState) {
        Channel channel = channels.remove(deploymentId);
        if (channel == null) {
            return;
        }
        synchronized (channel) {
            channel.finalState = finalState;
            for (DeploymentLogListener listener : channel.listeners) {
                try {
                    listener.onComplete(finalState);
                } catch (Exception e) {
                    log.debug("Log subscriber of deployment {} failed on completion: {}", deploymentId, e.getMessage());
                }
            }
            channel.listeners.clear();
        }
    }

    public List<DeploymentLogLine> history(UUID deploymentId) {
        return logRepository.findByDeploymentIdOrderBySequenceAsc(deploymentId).stream()
            .map(DeploymentLogLine::from)
            .toList();
    }

    private void unsubscribe(UUID deploymentId, DeploymentLogListener listener) {
        Channel channel = channels.get(deploymentId);
        if (channel != null) {
            synchronized (channel) {
                channel.listeners.remove(listener);
            }
        }
    }

    private Channel channel(UUID deploymentId) {
        return channels.computeIfAbsent(deploymentId, id -> {
            Channel channel = new Channel();
            for (DeploymentLogEntry entry : logRepository.findByDeploymentIdOrderBySequenceAsc(id)) {
                channel.buffer.add(DeploymentLogLine.from(entry));
                channel.nextSequence = Math.max(channel.nextSequence, entry.getSequence());
            }
            return channel;
        });
    }

    private Optional<DeploymentState> terminalState(UUID deploymentId) {
        return deploymentRepository.findById(deploymentId)
            .map(Deployment::getState)
            .filter(DeploymentState::isTerminal);
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Channel {
        private final List<DeploymentLogLine> buffer = new ArrayList<>();
        private final List<DeploymentLogListener> listeners = new ArrayList<>();
        private long nextSequence;
        private DeploymentState finalState;
    }
}
