package com.mike.leadscout.email.verify;

import java.util.List;

public interface MxLookUp {

    enum MxStatus { VALID, INVALID, UNKNOWN }

    MxStatus checkDomain(String domain);

    /**
     * Mail exchangers ordered by preference, empty when the domain has none or DNS could not answer.
     */
    List<String> mxHosts(String domain);
}
