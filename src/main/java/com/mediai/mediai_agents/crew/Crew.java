package com.mediai.mediai_agents.crew;

import com.mediai.mediai_agents.model.crew.CrewContext;
import com.mediai.mediai_agents.model.crew.CrewReport;

public interface Crew {

    String name();

    // Runs the tasks present in the context, in declared order, stopping at the first failure
    CrewReport kickoff(CrewContext context);
}
