package com.liftrx.service.solver;

class IndexedSolverBackendTest extends SolverBackendConformance {

    @Override
    protected SolverBackend createBackend(SolverComponents components) {
        return new IndexedSolverBackend(components);
    }
}
