package com.foiarelay.directory.delivery;

import com.foiarelay.directory.compose.PortalManifest;

/**
 * Opens the agency portal and applies the manifest's fields in order. The final submit
 * (and any CAPTCHA) is left to the requester.
 */
public interface PortalAutomation {

    void prefill(PortalManifest manifest);
}
