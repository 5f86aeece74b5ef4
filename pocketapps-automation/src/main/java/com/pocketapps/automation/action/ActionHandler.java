package com.pocketapps.automation.action;

import com.pocketapps.automation.data.DataPoint;
import com.pocketapps.automation.job.Job;

import java.util.List;

/**
 * Executes one action kind for a job.
 *
 * @param <C> the config record of the kind
 */
public interface ActionHandler<C extends ActionConfig> {

    /**
     * @return the data points written, possibly none
     */
    List<DataPoint> execute(Job job, C config);
}
