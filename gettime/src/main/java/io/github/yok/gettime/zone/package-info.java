/**
 * Timezone database access and zone identifier validation.
 */
package io.github.yok.gettime.zone;
