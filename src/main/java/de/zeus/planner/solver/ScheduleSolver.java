package de.zeus.planner.solver;

/**
 * Battery dispatch optimizer. Implementations must return one result per input slot,
 * in input order, and must not mutate the input.
 * <p>
 * The target SoC is a soft term of the objective; it can never make a problem infeasible.
 */
public interface ScheduleSolver {

    SolverResult solve(SolverInput input);
}
