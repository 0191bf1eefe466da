package org.trackstats;

import com.espertech.esper.common.client.EPCompiled;
import com.espertech.esper.common.client.EventBean;
import com.espertech.esper.common.client.configuration.Configuration;
import com.espertech.esper.compiler.client.CompilerArguments;
import com.espertech.esper.compiler.client.EPCompileException;
import com.espertech.esper.compiler.client.EPCompiler;
import com.espertech.esper.compiler.client.EPCompilerProvider;
import com.espertech.esper.runtime.client.EPDeployException;
import com.espertech.esper.runtime.client.EPDeployment;
import com.espertech.esper.runtime.client.EPRuntime;
import com.espertech.esper.runtime.client.EPRuntimeProvider;
import com.espertech.esper.runtime.client.EPStatement;
import com.espertech.esper.runtime.client.EPUndeployException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Feeds track points arriving as Esper events into a {@link TrackStatisticsAggregator}.
 * <p>
 * Events are delivered to the aggregator in the order they are sent, so one stream must only
 * carry the points of one document.
 */
public class TrackStatisticsStream {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrackStatisticsStream.class);

    public static final String EVENT_TYPE = "TrackPoint";

    private final EPRuntime runtime;
    private final TrackStatisticsAggregator aggregator;
    private String deploymentId;

    public TrackStatisticsStream(EPRuntime runtime, TrackStatisticsAggregator aggregator) {
        this.runtime = runtime;
        this.aggregator = aggregator;
    }

    /**
     * Configuration declaring the {@link TrackPoint} event type, for runtimes created by callers.
     */
    public static Configuration configuration() {
        Configuration config = new Configuration();
        config.getCommon().addEventType(EVENT_TYPE, TrackPoint.class);
        return config;
    }

    /** Runtime with the track point event type registered under its own URI. */
    public static EPRuntime createRuntime(String uri) {
        return EPRuntimeProvider.getRuntime(uri, configuration());
    }

    /**
     * Compiles and deploys the statement forwarding every track point to the aggregator.
     *
     * @throws TrackStatisticsException if the statement cannot be compiled or deployed
     */
    public void start() {
        if (deploymentId != null) {
            return;
        }
        String epl = "select * from " + EVENT_TYPE;
        try {
            EPCompiler compiler = EPCompilerProvider.getCompiler();
            CompilerArguments arguments = new CompilerArguments(runtime.getConfigurationDeepCopy());
            EPCompiled compiledQuery = compiler.compile(epl, arguments);
            EPDeployment deployment = runtime.getDeploymentService().deploy(compiledQuery);
            deploymentId = deployment.getDeploymentId();
            EPStatement statement = deployment.getStatements()[0];

            statement.addListener((newData, oldData, stat, rt) -> onPoints(newData));
            LOGGER.debug("Deployed track point statement {}", deploymentId);
        } catch (EPCompileException | EPDeployException e) {
            throw new TrackStatisticsException("Error in compiling or deploying EPL: " + e.getMessage(), e);
        }
    }

    private void onPoints(EventBean[] newData) {
        if (newData == null) {
            return;
        }
        for (EventBean event : newData) {
            aggregator.process((TrackPoint) event.getUnderlying());
        }
    }

    public void send(TrackPoint point) {
        if (deploymentId == null) {
            throw new IllegalStateException("Stream not started");
        }
        runtime.getEventService().sendEventBean(point, EVENT_TYPE);
    }

    public void sendSegment(List<TrackPoint> segment) {
        for (TrackPoint point : segment) {
            send(point);
        }
    }

    /**
     * Undeploys the statement and finalizes the statistics of the streamed document.
     */
    public TrackStatistics finish() {
        if (deploymentId != null) {
            try {
                runtime.getDeploymentService().undeploy(deploymentId);
            } catch (EPUndeployException e) {
                throw new TrackStatisticsException("Error undeploying the EPL statement: " + e.getMessage(), e);
            } finally {
                deploymentId = null;
            }
        }
        return aggregator.finish();
    }
}
