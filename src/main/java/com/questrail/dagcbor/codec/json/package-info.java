/**
 * Jackson mapping for links in JSON documents.
 *
 * <p>All Jackson-specific types are confined to this package.</p>
 */
package com.questrail.dagcbor.codec.json;
