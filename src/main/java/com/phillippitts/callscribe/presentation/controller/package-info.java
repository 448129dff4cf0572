/**
 * REST controllers for operating the recorder.
 */
package com.phillippitts.callscribe.presentation.controller;
