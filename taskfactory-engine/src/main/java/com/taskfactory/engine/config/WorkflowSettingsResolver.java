package com.taskfactory.engine.config;

import com.taskfactory.core.admission.AdmissionController;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.WorkflowSettings;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.core.repository.WorkspaceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Resolves effective workflow settings. Reads global defaults and workspace
 * overrides on every call so live reconfiguration takes effect on the next check.
 */
public class WorkflowSettingsResolver {

    private static final Logger log = LoggerFactory.getLogger(WorkflowSettingsResolver.class);

    private final TaskFactoryProperties properties;
    private final WorkspaceRepository workspaceRepository;

    public WorkflowSettingsResolver(TaskFactoryProperties properties, WorkspaceRepository workspaceRepository) {
        this.properties = properties;
        this.workspaceRepository = workspaceRepository;
    }

    public WorkflowSettings globalDefaults() {
        synchronized (properties) {
            return properties.getWorkflow().toSettings();
        }
    }

    public WorkflowSettings resolve(String workspaceId) {
        return globalDefaults().resolve(
            workspaceRepository.findById(workspaceId).map(Workspace::config).orElse(null));
    }

    /**
     * Replace global defaults. Limits present in {@code limits} are set (null
     * means unlimited); absent phases keep their current value.
     */
    public WorkflowSettings updateGlobalDefaults(Map<Phase, Integer> limits, Boolean promoteOnPlanReady, Boolean autoExecute) {
        if (limits != null) {
            AdmissionController.validateLimits(limits);
        }
        synchronized (properties) {
            TaskFactoryProperties.Workflow workflow = properties.getWorkflow();
            if (limits != null) {
                limits.forEach(workflow::setLimit);
            }
            if (promoteOnPlanReady != null) {
                workflow.setPromoteOnPlanReady(promoteOnPlanReady);
            }
            if (autoExecute != null) {
                workflow.setAutoExecute(autoExecute);
            }
            WorkflowSettings updated = workflow.toSettings();
            log.info("Global workflow defaults updated: limits={}, promoteOnPlanReady={}, autoExecute={}",
                updated.wipLimits(), updated.promoteOnPlanReady(), updated.autoExecute());
            return updated;
        }
    }
}
