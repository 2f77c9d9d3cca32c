/**
 * REST endpoints for controlling the listening session.
 */
package com.phillippitts.vinylscrobbler.presentation.controller;
