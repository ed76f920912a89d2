package com.salesdw.service;

/**
 * Work done for one table inside a layer run.
 */
@FunctionalInterface
public interface TableStep {

    /**
     * @return message recorded in the load log when the step succeeds
     */
    String execute() throws Exception;
}
