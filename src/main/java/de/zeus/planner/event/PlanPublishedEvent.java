package de.zeus.planner.event;

import de.zeus.planner.model.PlanResult;

public class PlanPublishedEvent {
    private final Object source;
    private final PlanResult plan;

    public PlanPublishedEvent(Object source, PlanResult plan) {
        this.source = source;
        this.plan = plan;
    }

    public Object getSource() {
        return source;
    }

    public PlanResult getPlan() {
        return plan;
    }
}
