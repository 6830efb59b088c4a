package com.example.renditions.service;

import com.example.renditions.exceptions.EncodeProcessException;

public interface MediaEncoder {

    /**
     * Launches the external encoder. Returns as soon as the process is running.
     *
     * @throws EncodeProcessException if the process cannot be started.
     */
    EncodeProcess start(EncodeRequest request) throws EncodeProcessException;
}
