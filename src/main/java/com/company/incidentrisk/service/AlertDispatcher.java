package com.company.incidentrisk.service;

import com.company.incidentrisk.domain.Alert;

/**
 * Outbound alert channel. Implementations throw on delivery failure.
 */
public interface AlertDispatcher {

    void dispatch(Alert alert);
}
