package com.outcast.rivalry.service;

/** Remote calls made and avoided by one league task. Confined to the worker running it. */
final class CallCounter {
    int made;
    int saved;

    void made() { made++; }
    void saved() { saved++; }
}
