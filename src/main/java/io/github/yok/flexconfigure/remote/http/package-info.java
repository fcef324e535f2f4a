/**
 * HTTP client for the tenant's OData API.
 */
package io.github.yok.flexconfigure.remote.http;
